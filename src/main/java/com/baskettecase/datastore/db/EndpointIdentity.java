package com.baskettecase.datastore.db;

/**
 * The physical database a DSN points at, without any credentials.
 * Two DSNs with different users on the same host, port and database have equal identities.
 */
public record EndpointIdentity(String host, int port, String database) {

    @Override
    public String toString() {
        return host + ":" + port + "/" + database;
    }
}
