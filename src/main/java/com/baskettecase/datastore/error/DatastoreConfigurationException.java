package com.baskettecase.datastore.error;

/**
 * Raised at startup when the datastore endpoints are missing, malformed,
 * or not separated from each other.
 */
public class DatastoreConfigurationException extends DatastoreException {

    public DatastoreConfigurationException(String message) {
        super(message);
    }

    public DatastoreConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
