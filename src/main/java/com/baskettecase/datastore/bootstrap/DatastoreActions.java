package com.baskettecase.datastore.bootstrap;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Names of the datastore actions the API layer may register.
 *
 * {@code datastore_search_sql} runs arbitrary SELECTs with the read-only user, so it is only
 * offered once a read endpoint has been configured and has passed the startup checks.
 */
public final class DatastoreActions {

    public static final String CREATE = "datastore_create";
    public static final String UPSERT = "datastore_upsert";
    public static final String DELETE = "datastore_delete";
    public static final String SEARCH = "datastore_search";
    public static final String SEARCH_SQL = "datastore_search_sql";

    private DatastoreActions() {
    }

    public static Set<String> available(boolean readEndpointVerified) {
        Set<String> actions = new LinkedHashSet<>(List.of(CREATE, UPSERT, DELETE, SEARCH));
        if (readEndpointVerified) {
            actions.add(SEARCH_SQL);
        }
        return Collections.unmodifiableSet(actions);
    }
}
