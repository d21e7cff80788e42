package com.baskettecase.datastore.metadata;

import com.baskettecase.datastore.error.DatastoreConfigurationException;

import java.util.regex.Pattern;

/**
 * Location of the {@code _table_metadata} view.
 *
 * The schema name ends up inside DDL, so only plain identifiers are accepted.
 */
public record TableMetadataView(String schema) {

    public static final String VIEW_NAME = "_table_metadata";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public TableMetadataView {
        if (schema == null || !IDENTIFIER.matcher(schema).matches()) {
            throw new DatastoreConfigurationException("Invalid datastore schema name: '" + schema + "'");
        }
    }

    public String qualifiedName() {
        return "\"" + schema + "\".\"" + VIEW_NAME + "\"";
    }
}
