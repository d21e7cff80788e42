package com.baskettecase.datastore.db;

/**
 * A resolved endpoint: its role, the database it targets and the DSN used to reach it.
 */
public record ConnectionEndpoint(EndpointRole role, EndpointIdentity identity, Dsn dsn) {

    /**
     * Database user this endpoint connects as (may be null when the DSN carries none)
     */
    public String principal() {
        return dsn.username();
    }

    @Override
    public String toString() {
        return role + "[" + dsn.redacted() + "]";
    }
}
