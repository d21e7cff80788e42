package com.baskettecase.datastore.bootstrap;

import com.baskettecase.datastore.config.DatastoreProperties;
import com.baskettecase.datastore.db.ConnectionEndpoint;
import com.baskettecase.datastore.db.ResolvedEndpoints;
import com.baskettecase.datastore.metadata.AliasViewBuilder;
import com.baskettecase.datastore.metadata.AliasViewState;
import com.baskettecase.datastore.security.ProbeReport;
import com.baskettecase.datastore.security.ReadPermissionProbe;
import com.baskettecase.datastore.security.SeparationValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Datastore Bootstrap
 *
 * Runs the startup checks in order: endpoint separation, read permission probe, alias view.
 * Any failure is thrown as is so that the application context, and with it the process, fails
 * to start. Nothing here retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatastoreBootstrap {

    private final ResolvedEndpoints endpoints;
    private final DatastoreProperties properties;
    private final SeparationValidator separationValidator;
    private final ReadPermissionProbe readPermissionProbe;
    private final AliasViewBuilder aliasViewBuilder;
    private final Clock clock;

    public DatastoreStatus initialize() {
        log.info("🔧 Checking datastore configuration...");

        boolean separationChecked = false;
        ProbeReport probeReport = null;

        if (endpoints.hasReadEndpoint()) {
            ConnectionEndpoint read = endpoints.read();

            separationValidator.validate(endpoints, properties.isDebug());
            separationChecked = !properties.isDebug();

            probeReport = readPermissionProbe.probe(read, properties.getProbeTable());
        } else {
            log.info("No read endpoint configured; datastore_search_sql will not be available");
        }

        AliasViewState aliasView = aliasViewBuilder.ensureAliasView();

        DatastoreStatus status = new DatastoreStatus(
            endpoints.write().identity(),
            endpoints.readEndpoint().map(ConnectionEndpoint::identity).orElse(null),
            separationChecked,
            probeReport,
            aliasView,
            DatastoreActions.available(probeReport != null),
            Instant.now(clock)
        );

        log.info("✅ Datastore checks passed: actions={}", status.availableActions());
        return status;
    }
}
