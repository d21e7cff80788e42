package com.baskettecase.datastore.db;

import com.baskettecase.datastore.config.DatastoreProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Builds HikariCP data sources for resolved endpoints.
 *
 * Credentials always come from the endpoint's DSN. Pools never set
 * {@code default_transaction_read_only}: the permission probe must see the grants of the
 * read user itself, not a session setting that would make every write fail anyway.
 */
@Slf4j
@Component
public class EndpointDataSourceFactory {

    private static final String APPLICATION_NAME = "datastore-guard";

    /**
     * Create a long-lived pool for an endpoint
     */
    public HikariDataSource createPool(ConnectionEndpoint endpoint, DatastoreProperties.Pool pool) {
        String poolName = "datastore-" + endpoint.role().name().toLowerCase(Locale.ROOT);
        HikariConfig config = baseConfig(endpoint, poolName);

        config.setMaximumPoolSize(pool.getMaximumPoolSize());
        config.setMinimumIdle(pool.getMinimumIdle());
        config.setConnectionTimeout(pool.getConnectionTimeoutMs());
        config.setIdleTimeout(pool.getIdleTimeoutMs());
        config.setMaxLifetime(pool.getMaxLifetimeMs());

        config.setConnectionTestQuery("SELECT 1");
        config.setValidationTimeout(5000);
        config.setConnectionInitSql("SET statement_timeout = " + pool.getStatementTimeoutMs());

        HikariDataSource dataSource = new HikariDataSource(config);
        log.info("📊 Pool '{}' for {}: max={}, min={}, idle={}ms",
            poolName, endpoint.identity(), config.getMaximumPoolSize(), config.getMinimumIdle(),
            config.getIdleTimeout());
        return dataSource;
    }

    /**
     * Create a single-connection data source for short checks. The caller closes it.
     */
    public HikariDataSource createProbeDataSource(ConnectionEndpoint endpoint) {
        HikariConfig config = baseConfig(endpoint, "datastore-probe-" + endpoint.role().name().toLowerCase(Locale.ROOT));
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(0);
        config.setConnectionTimeout(10000);
        config.setAutoCommit(false);
        return new HikariDataSource(config);
    }

    private HikariConfig baseConfig(ConnectionEndpoint endpoint, String poolName) {
        Dsn dsn = endpoint.dsn();
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(dsn.jdbcUrl());
        if (dsn.username() != null) {
            config.setUsername(dsn.username());
        }
        if (dsn.password() != null) {
            config.setPassword(dsn.password());
        }
        config.setPoolName(poolName);
        config.setReadOnly(false);
        config.addDataSourceProperty("ApplicationName", APPLICATION_NAME);
        return config;
    }
}
