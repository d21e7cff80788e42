package com.baskettecase.datastore.error;

/**
 * Raised when the read-only credential turns out to be able to change the database.
 */
public class DatastoreSecurityException extends DatastoreException {

    private final String statement;

    public DatastoreSecurityException(String message, String statement) {
        super(message);
        this.statement = statement;
    }

    /**
     * The probe statement that was allowed to run
     */
    public String getStatement() {
        return statement;
    }
}
