package com.baskettecase.datastore.security;

/**
 * Why a probe statement was rejected by the database.
 */
public enum FailureKind {
    /** The role lacks the privilege (SQLState 42501) */
    PERMISSION_DENIED,
    /** The server only accepts read-only transactions, e.g. a hot standby (SQLState 25006) */
    READ_ONLY_REPLICA,
    /** Anything else */
    UNEXPECTED;

    public boolean isExpected() {
        return this != UNEXPECTED;
    }
}
