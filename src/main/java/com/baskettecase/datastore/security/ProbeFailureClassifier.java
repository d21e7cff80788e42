package com.baskettecase.datastore.security;

import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Classifies the errors returned for probe statements.
 *
 * SQLState codes decide. Message text is only consulted when no exception in the chain
 * carries a state at all; any other reported state is unexpected.
 */
@Component
public class ProbeFailureClassifier {

    static final String INSUFFICIENT_PRIVILEGE = "42501";
    static final String READ_ONLY_SQL_TRANSACTION = "25006";

    public FailureKind classify(SQLException error) {
        boolean stateReported = false;
        for (SQLException current = error; current != null; current = current.getNextException()) {
            String state = current.getSQLState();
            if (INSUFFICIENT_PRIVILEGE.equals(state)) {
                return FailureKind.PERMISSION_DENIED;
            }
            if (READ_ONLY_SQL_TRANSACTION.equals(state)) {
                return FailureKind.READ_ONLY_REPLICA;
            }
            stateReported |= state != null && !state.isBlank();
        }
        if (stateReported) {
            return FailureKind.UNEXPECTED;
        }

        String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("permission denied")) {
            return FailureKind.PERMISSION_DENIED;
        }
        if (message.contains("read-only transaction")) {
            return FailureKind.READ_ONLY_REPLICA;
        }
        return FailureKind.UNEXPECTED;
    }
}
