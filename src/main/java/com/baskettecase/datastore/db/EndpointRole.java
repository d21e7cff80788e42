package com.baskettecase.datastore.db;

/**
 * Logical database endpoints known to the datastore guard.
 */
public enum EndpointRole {
    /** The application's own database */
    CONTROL,
    /** Datastore connection used for DDL and DML */
    WRITE,
    /** Datastore connection handed to read-only API consumers */
    READ
}
