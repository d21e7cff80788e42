package com.baskettecase.datastore.security;

import java.sql.SQLException;

/**
 * Result of running one probe statement against the read endpoint.
 *
 * @param statement the SQL that was attempted
 * @param status what happened
 * @param kind failure classification, null when the statement succeeded
 * @param error the driver error, null when the statement succeeded
 */
public record ProbeOutcome(String statement, Status status, FailureKind kind, SQLException error) {

    public enum Status {
        SUCCEEDED,
        EXPECTED_FAILURE,
        UNEXPECTED_FAILURE
    }

    public static ProbeOutcome succeeded(String statement) {
        return new ProbeOutcome(statement, Status.SUCCEEDED, null, null);
    }

    public static ProbeOutcome failed(String statement, FailureKind kind, SQLException error) {
        Status status = kind.isExpected() ? Status.EXPECTED_FAILURE : Status.UNEXPECTED_FAILURE;
        return new ProbeOutcome(statement, status, kind, error);
    }
}
