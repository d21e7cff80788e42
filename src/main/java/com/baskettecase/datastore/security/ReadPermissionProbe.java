package com.baskettecase.datastore.security;

import com.baskettecase.datastore.db.ConnectionEndpoint;
import com.baskettecase.datastore.db.EndpointDataSourceFactory;
import com.baskettecase.datastore.error.DatastoreConfigurationException;
import com.baskettecase.datastore.error.DatastoreSecurityException;
import com.baskettecase.datastore.error.UnexpectedDatabaseException;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Read Permission Probe
 *
 * Checks that the read-only user really is read-only by trying to change the datastore with it.
 * Every statement runs in its own transaction which is always rolled back. A statement that
 * succeeds is a security failure; an error other than "permission denied" or "read-only
 * transaction" is fatal as well, since it leaves the user's permissions unverified.
 *
 * The probe table is created with the read-only user by deployment tooling and must exist
 * before startup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReadPermissionProbe {

    private static final Pattern TABLE_NAME = Pattern.compile(
        "[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final EndpointDataSourceFactory dataSourceFactory;
    private final ProbeFailureClassifier classifier;
    private final MeterRegistry meterRegistry;

    /**
     * Statements the read-only user must not be able to run, in execution order
     */
    public List<String> probeStatements(String probeTable) {
        if (probeTable == null || !TABLE_NAME.matcher(probeTable).matches()) {
            throw new DatastoreConfigurationException("Invalid probe table name: '" + probeTable + "'");
        }
        return List.of(
            "CREATE TABLE " + probeTable + " (id INTEGER NOT NULL, name VARCHAR)",
            "INSERT INTO " + probeTable + " VALUES (1, 'probe')"
        );
    }

    /**
     * Probe the read endpoint.
     *
     * @return the outcome of every statement, all of them expected failures
     * @throws DatastoreSecurityException if any statement succeeds
     * @throws UnexpectedDatabaseException if a statement fails for an unrecognised reason
     *         or the endpoint cannot be reached
     */
    public ProbeReport probe(ConnectionEndpoint readEndpoint, String probeTable) {
        List<String> statements = probeStatements(probeTable);
        log.info("🔐 Probing write permissions of {} using table {}", readEndpoint.identity(), probeTable);

        List<ProbeOutcome> outcomes = new ArrayList<>();
        try (HikariDataSource dataSource = dataSourceFactory.createProbeDataSource(readEndpoint);
             Connection connection = dataSource.getConnection()) {

            connection.setAutoCommit(false);

            for (String sql : statements) {
                ProbeOutcome outcome = attempt(connection, sql);
                countOutcome(outcome);

                switch (outcome.status()) {
                    case SUCCEEDED -> {
                        log.error("❌ Read-only user on {} was allowed to run: {}", readEndpoint.identity(), sql);
                        throw new DatastoreSecurityException(
                            "We have write permissions on the read-only database.", sql);
                    }
                    case UNEXPECTED_FAILURE -> throw new UnexpectedDatabaseException(
                        "Unexpected error while probing read-only permissions with: " + sql, outcome.error());
                    case EXPECTED_FAILURE -> log.info("✅ Rejected as expected ({}): {}", outcome.kind(), sql);
                }
                outcomes.add(outcome);
            }
        } catch (SQLException | HikariPool.PoolInitializationException e) {
            throw new UnexpectedDatabaseException(
                "Could not open a connection to the read endpoint " + readEndpoint.identity(), e);
        }

        return new ProbeReport(readEndpoint.identity(), probeTable, outcomes);
    }

    private ProbeOutcome attempt(Connection connection, String sql) {
        try {
            return execute(connection, sql);
        } finally {
            rollback(connection, sql);
        }
    }

    private ProbeOutcome execute(Connection connection, String sql) {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
            return ProbeOutcome.succeeded(sql);
        } catch (SQLException e) {
            log.debug("Probe statement failed with SQLState {}: {}", e.getSQLState(), e.getMessage());
            return ProbeOutcome.failed(sql, classifier.classify(e), e);
        }
    }

    private void rollback(Connection connection, String sql) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw new UnexpectedDatabaseException("Failed to roll back probe statement: " + sql, e);
        }
    }

    private void countOutcome(ProbeOutcome outcome) {
        Counter.builder("datastore.probe.statements")
            .description("Probe statements run against the read endpoint")
            .tag("outcome", outcome.status().name().toLowerCase(Locale.ROOT))
            .register(meterRegistry)
            .increment();
    }
}
