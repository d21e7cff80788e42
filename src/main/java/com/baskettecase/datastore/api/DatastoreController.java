package com.baskettecase.datastore.api;

import com.baskettecase.datastore.bootstrap.DatastoreStatus;
import com.baskettecase.datastore.error.DatastoreException;
import com.baskettecase.datastore.metadata.CatalogDependency;
import com.baskettecase.datastore.metadata.TableMetadataService;
import com.baskettecase.datastore.resource.ActiveFlagResolver;
import com.baskettecase.datastore.resource.ResourceDescriber;
import com.baskettecase.datastore.resource.ResourceDescriptor;
import com.baskettecase.datastore.security.ProbeOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Datastore Controller
 *
 * REST endpoints for inspecting the datastore: the result of the startup checks, the alias view,
 * and resource descriptions carrying {@code datastore_active}.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/datastore")
@RequiredArgsConstructor
public class DatastoreController {

    private final DatastoreStatus status;
    private final TableMetadataService tableMetadataService;
    private final ActiveFlagResolver activeFlagResolver;
    private final ObjectProvider<ResourceDescriber> resourceDescriber;

    @GetMapping("/status")
    public StatusResponse getStatus() {
        List<ProbeResult> probes = status.probe() == null
            ? List.of()
            : status.probe().outcomes().stream().map(ProbeResult::from).toList();

        return new StatusResponse(
            status.write().toString(),
            status.read() != null ? status.read().toString() : null,
            status.separationChecked(),
            probes,
            status.aliasView().name(),
            status.availableActions(),
            status.initializedAt()
        );
    }

    /**
     * All aliases, or only those of {@code table} when given
     */
    @GetMapping("/aliases")
    public List<CatalogDependency> getAliases(@RequestParam(required = false) String table) {
        return table == null || table.isBlank()
            ? tableMetadataService.findAll()
            : tableMetadataService.findAliasesOf(table);
    }

    @GetMapping("/resources/{resourceId}")
    public ResponseEntity<ResourceDescriptor> getResource(@PathVariable String resourceId) {
        ResourceDescriber describer = resourceDescriber.getIfAvailable();
        if (describer == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return ResponseEntity.ok(activeFlagResolver.describeWithActiveFlag(resourceId, describer));
    }

    @ExceptionHandler(DatastoreException.class)
    public ResponseEntity<ErrorResponse> handleDatastoreException(DatastoreException e) {
        log.error("Datastore request failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(e.getClass().getSimpleName(), e.getMessage()));
    }

    /**
     * Response for /status
     */
    public record StatusResponse(
        String writeEndpoint,
        String readEndpoint,
        boolean separationChecked,
        List<ProbeResult> probes,
        String aliasView,
        Set<String> availableActions,
        Instant initializedAt
    ) {}

    /**
     * One probe statement as reported by /status
     */
    public record ProbeResult(String statement, String status, String kind) {

        static ProbeResult from(ProbeOutcome outcome) {
            return new ProbeResult(
                outcome.statement(),
                outcome.status().name(),
                outcome.kind() != null ? outcome.kind().name() : null);
        }
    }

    public record ErrorResponse(String error, String message) {}
}
