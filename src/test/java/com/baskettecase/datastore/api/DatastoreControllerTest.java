package com.baskettecase.datastore.api;

import com.baskettecase.datastore.bootstrap.DatastoreActions;
import com.baskettecase.datastore.bootstrap.DatastoreStatus;
import com.baskettecase.datastore.db.EndpointIdentity;
import com.baskettecase.datastore.error.UnexpectedDatabaseException;
import com.baskettecase.datastore.metadata.AliasViewState;
import com.baskettecase.datastore.metadata.CatalogDependency;
import com.baskettecase.datastore.metadata.TableMetadataService;
import com.baskettecase.datastore.resource.ActiveFlagResolver;
import com.baskettecase.datastore.resource.ResourceDescriber;
import com.baskettecase.datastore.resource.ResourceDescriptor;
import com.baskettecase.datastore.security.FailureKind;
import com.baskettecase.datastore.security.ProbeOutcome;
import com.baskettecase.datastore.security.ProbeReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DatastoreController
 */
@ExtendWith(MockitoExtension.class)
class DatastoreControllerTest {

    @Mock
    private TableMetadataService tableMetadataService;

    @Mock
    private ActiveFlagResolver activeFlagResolver;

    @Mock
    private ObjectProvider<ResourceDescriber> resourceDescriber;

    private DatastoreController controller;

    @BeforeEach
    void setUp() {
        EndpointIdentity write = new EndpointIdentity("db", 5432, "datastore");
        EndpointIdentity read = new EndpointIdentity("replica", 5432, "datastore");
        ProbeReport probe = new ProbeReport(read, "public.writetest", List.of(
            ProbeOutcome.failed("CREATE TABLE public.writetest (id INTEGER NOT NULL, name VARCHAR)",
                FailureKind.READ_ONLY_REPLICA, new SQLException("read-only transaction", "25006"))));
        DatastoreStatus status = new DatastoreStatus(write, read, true, probe, AliasViewState.ALREADY_PRESENT,
            DatastoreActions.available(true), Instant.parse("2026-01-01T00:00:00Z"));

        controller = new DatastoreController(status, tableMetadataService, activeFlagResolver, resourceDescriber);
    }

    @Test
    void testStatusReportsProbeResults() {
        DatastoreController.StatusResponse response = controller.getStatus();

        assertEquals("db:5432/datastore", response.writeEndpoint());
        assertEquals("replica:5432/datastore", response.readEndpoint());
        assertEquals(1, response.probes().size());
        assertEquals("EXPECTED_FAILURE", response.probes().get(0).status());
        assertEquals("READ_ONLY_REPLICA", response.probes().get(0).kind());
        assertEquals("ALREADY_PRESENT", response.aliasView());
        assertTrue(response.availableActions().contains("datastore_search_sql"));
    }

    @Test
    void testAliasesFilteredByTable() {
        when(tableMetadataService.findAliasesOf("abc123"))
            .thenReturn(List.of(new CatalogDependency("abc123", "prices")));

        assertEquals(1, controller.getAliases("abc123").size());
        verify(tableMetadataService, never()).findAll();
    }

    @Test
    void testAllAliasesWithoutFilter() {
        when(tableMetadataService.findAll()).thenReturn(List.of());

        assertTrue(controller.getAliases(null).isEmpty());
    }

    @Test
    void testResourceWithoutDescriberIsUnavailable() {
        when(resourceDescriber.getIfAvailable()).thenReturn(null);

        ResponseEntity<ResourceDescriptor> response = controller.getResource("abc123");

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        verifyNoInteractions(activeFlagResolver);
    }

    @Test
    void testResourceIsDescribedWithFlag() {
        ResourceDescriber describer = id -> new ResourceDescriptor(id, Map.of());
        ResourceDescriptor flagged = new ResourceDescriptor("abc123", Map.of()).withDatastoreActive(true);
        when(resourceDescriber.getIfAvailable()).thenReturn(describer);
        when(activeFlagResolver.describeWithActiveFlag(eq("abc123"), any())).thenReturn(flagged);

        ResponseEntity<ResourceDescriptor> response = controller.getResource("abc123");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(flagged, response.getBody());
    }

    @Test
    void testDatastoreErrorsBecomeServerErrors() {
        ResponseEntity<DatastoreController.ErrorResponse> response = controller.handleDatastoreException(
            new UnexpectedDatabaseException("Failed to look up datastore table", new SQLException("down", "08006")));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("UnexpectedDatabaseException", response.getBody().error());
    }
}
