package com.baskettecase.datastore.error;

/**
 * Base type for every failure raised by the datastore guard.
 */
public class DatastoreException extends RuntimeException {

    public DatastoreException(String message) {
        super(message);
    }

    public DatastoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
