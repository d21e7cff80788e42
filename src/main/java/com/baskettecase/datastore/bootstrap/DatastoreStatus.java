package com.baskettecase.datastore.bootstrap;

import com.baskettecase.datastore.db.EndpointIdentity;
import com.baskettecase.datastore.metadata.AliasViewState;
import com.baskettecase.datastore.security.ProbeReport;

import java.time.Instant;
import java.util.Set;

/**
 * Result of the startup checks. Only exists if every check passed.
 *
 * @param write write endpoint
 * @param read read endpoint, null when none is configured
 * @param separationChecked false when there is no read endpoint or debug mode skipped the check
 * @param probe permission probe report, null when there is no read endpoint
 * @param aliasView what happened to {@code _table_metadata}
 * @param availableActions datastore actions the API layer may expose
 * @param initializedAt when the checks completed
 */
public record DatastoreStatus(
    EndpointIdentity write,
    EndpointIdentity read,
    boolean separationChecked,
    ProbeReport probe,
    AliasViewState aliasView,
    Set<String> availableActions,
    Instant initializedAt
) {
}
