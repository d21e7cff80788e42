package com.baskettecase.datastore;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.event.EventListener;

/**
 * Datastore Guard Application
 *
 * Verifies the topology and permissions of a PostgreSQL datastore before any request is served,
 * maintains the {@code _table_metadata} alias view, and flags resources that are backed by a live table.
 */
@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
public class DatastoreGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(DatastoreGuardApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("🚀 Datastore Guard is ready!");
        log.info("🔧 Endpoints: /api/v1/datastore/status, /api/v1/datastore/aliases, /api/v1/datastore/resources/{id}");
        log.info("📊 Metrics available at: /actuator/prometheus");
        log.info("🏥 Health check at: /actuator/health");
    }
}
