package com.baskettecase.datastore.error;

import java.sql.SQLException;

/**
 * A database error that none of the guard's checks know how to interpret.
 */
public class UnexpectedDatabaseException extends DatastoreException {

    public UnexpectedDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * SQLState of the underlying driver error, if there is one
     */
    public String getSqlState() {
        Throwable current = getCause();
        while (current != null) {
            if (current instanceof SQLException sqlException) {
                return sqlException.getSQLState();
            }
            current = current.getCause();
        }
        return null;
    }
}
