package com.baskettecase.datastore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Datastore configuration bound from {@code application.yml}.
 *
 * Bound once at startup and only read afterwards; components receive the resolved
 * endpoints rather than this object wherever they can.
 */
@Data
@ConfigurationProperties(prefix = "datastore")
public class DatastoreProperties {

    /**
     * DSN of the application's own database. Only compared, never connected to.
     */
    private String controlUrl;

    /**
     * DSN with write access to the datastore. Required.
     */
    private String writeUrl;

    /**
     * DSN of the read-only datastore user. Optional.
     */
    private String readUrl;

    /**
     * Skips the endpoint separation check. The permission probe still runs.
     */
    private boolean debug = false;

    /**
     * Table the read-only user must not be able to create or insert into.
     * Provisioned together with the read-only user.
     */
    private String probeTable = "public.writetest";

    /**
     * Schema whose views are described by {@code _table_metadata}.
     */
    private String schema = "public";

    private Pool pool = new Pool();

    @Data
    public static class Pool {
        private int maximumPoolSize = 10;
        private int minimumIdle = 2;
        private long connectionTimeoutMs = 30000;
        private long idleTimeoutMs = 300000;
        private long maxLifetimeMs = 1800000;
        private int statementTimeoutMs = 5000;
    }
}
