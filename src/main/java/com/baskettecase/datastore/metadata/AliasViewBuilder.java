package com.baskettecase.datastore.metadata;

import com.baskettecase.datastore.error.UnexpectedDatabaseException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.util.Set;

/**
 * Alias View Builder
 *
 * Creates the {@code _table_metadata} view on the write endpoint. The view maps every view in the
 * datastore schema ({@code name}) to the relations it is built on ({@code alias_of}), so aliases can
 * be resolved with a single lookup instead of joining the system catalogs on every request.
 *
 * The view is created at most once. Several processes may start at the same time; the one that
 * loses the race gets a duplicate-object error, which counts as success.
 */
@Slf4j
@Service
public class AliasViewBuilder {

    private static final String VIEW_EXISTS_SQL = """
        SELECT 1 FROM pg_views WHERE viewname = ? AND schemaname = ?
        """;

    private static final String MAPPING_SQL = """
        SELECT DISTINCT
            dependee.relname AS name,
            dependent.relname AS alias_of
        FROM pg_attribute AS a
        JOIN pg_depend AS d ON d.refobjid = a.attrelid AND d.refobjsubid = a.attnum
        JOIN pg_rewrite AS r ON d.objid = r.oid
        JOIN pg_class AS dependee ON r.ev_class = dependee.oid
        JOIN pg_class AS dependent ON d.refobjid = dependent.oid
        WHERE dependee.relnamespace = (SELECT oid FROM pg_namespace WHERE nspname = '%s')
          AND dependee.oid <> dependent.oid
        """;

    // duplicate_table, duplicate_object, and unique_violation on pg_type when two CREATE VIEWs race
    private static final Set<String> DUPLICATE_OBJECT_STATES = Set.of("42P07", "42710", "23505");

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final TableMetadataView view;
    private final MeterRegistry meterRegistry;

    public AliasViewBuilder(@Qualifier("writeJdbcTemplate") JdbcTemplate jdbcTemplate,
                            @Qualifier("writeTransactionTemplate") TransactionTemplate transactionTemplate,
                            TableMetadataView view,
                            MeterRegistry meterRegistry) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.view = view;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Create {@code _table_metadata} unless it already exists
     *
     * @throws UnexpectedDatabaseException for any failure other than a concurrent creation
     */
    public AliasViewState ensureAliasView() {
        try {
            AliasViewState state = transactionTemplate.execute(status -> {
                if (aliasViewExists()) {
                    return AliasViewState.ALREADY_PRESENT;
                }
                jdbcTemplate.execute(createViewSql());
                return AliasViewState.CREATED;
            });

            if (state == AliasViewState.CREATED) {
                meterRegistry.counter("datastore.alias_view.created").increment();
                log.info("📦 Created {}", view.qualifiedName());
            } else {
                log.info("✅ {} already exists", view.qualifiedName());
            }
            return state;

        } catch (DataAccessException e) {
            if (isDuplicateObject(e)) {
                log.info("✅ {} was created concurrently by another process", view.qualifiedName());
                return AliasViewState.CREATED_CONCURRENTLY;
            }
            log.error("❌ Failed to create {}", view.qualifiedName(), e);
            throw new UnexpectedDatabaseException("Failed to create " + view.qualifiedName(), e);
        }
    }

    /**
     * Whether the view is present in the datastore schema
     */
    private boolean aliasViewExists() {
        return !jdbcTemplate.queryForList(VIEW_EXISTS_SQL, Integer.class,
            TableMetadataView.VIEW_NAME, view.schema()).isEmpty();
    }

    String createViewSql() {
        return "CREATE VIEW " + view.qualifiedName() + " AS " + MAPPING_SQL.formatted(view.schema());
    }

    private static boolean isDuplicateObject(DataAccessException e) {
        for (Throwable current = e; current != null; current = current.getCause()) {
            if (current instanceof SQLException sqlException
                    && DUPLICATE_OBJECT_STATES.contains(sqlException.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
