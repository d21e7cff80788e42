package com.baskettecase.datastore.security;

import com.baskettecase.datastore.db.ConnectionEndpoint;
import com.baskettecase.datastore.db.Dsn;
import com.baskettecase.datastore.db.EndpointRole;
import com.baskettecase.datastore.db.ResolvedEndpoints;
import com.baskettecase.datastore.error.DatastoreConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SeparationValidator
 */
class SeparationValidatorTest {

    private final SeparationValidator validator = new SeparationValidator();

    private static ConnectionEndpoint endpoint(EndpointRole role, String url) {
        Dsn dsn = Dsn.parse(url);
        return new ConnectionEndpoint(role, dsn.identity(), dsn);
    }

    @Test
    void testSeparateDatabasesPass() {
        ResolvedEndpoints endpoints = new ResolvedEndpoints(
            endpoint(EndpointRole.CONTROL, "postgresql://roleX:pw@db/dbA"),
            endpoint(EndpointRole.WRITE, "postgresql://roleY:pw@db/dbB"),
            endpoint(EndpointRole.READ, "postgresql://roleZ:pw@db/dbB"));

        assertDoesNotThrow(() -> validator.validate(endpoints, false));
    }

    @Test
    void testSameWriteAndReadUrlFails() {
        ResolvedEndpoints endpoints = new ResolvedEndpoints(
            endpoint(EndpointRole.CONTROL, "postgresql://app:pw@db/app"),
            endpoint(EndpointRole.WRITE, "postgresql://writer:pw@db/datastore"),
            endpoint(EndpointRole.READ, "postgresql://writer:pw@db/datastore"));

        DatastoreConfigurationException e = assertThrows(DatastoreConfigurationException.class,
            () -> validator.validate(endpoints, false));
        assertTrue(e.getMessage().contains("write and read-only"));
    }

    @Test
    void testSameWriteAndReadUserInDifferentUrlFormsFails() {
        ResolvedEndpoints endpoints = new ResolvedEndpoints(
            null,
            endpoint(EndpointRole.WRITE, "postgresql://writer:pw@DB:5432/datastore"),
            endpoint(EndpointRole.READ, "jdbc:postgresql://db/datastore?user=writer&password=pw"));

        assertThrows(DatastoreConfigurationException.class, () -> validator.validate(endpoints, false));
    }

    @Test
    void testControlAndReadOnSameDatabaseFails() {
        ResolvedEndpoints endpoints = new ResolvedEndpoints(
            endpoint(EndpointRole.CONTROL, "postgresql://ckan:pw@db/ckan"),
            endpoint(EndpointRole.WRITE, "postgresql://writer:pw@db/datastore"),
            endpoint(EndpointRole.READ, "postgresql://reader:other@db/ckan"));

        DatastoreConfigurationException e = assertThrows(DatastoreConfigurationException.class,
            () -> validator.validate(endpoints, false));
        assertTrue(e.getMessage().contains("control and datastore"));
    }

    @Test
    void testSameDatabaseNameOnDifferentHostsPasses() {
        ResolvedEndpoints endpoints = new ResolvedEndpoints(
            endpoint(EndpointRole.CONTROL, "postgresql://app:pw@primary/app"),
            endpoint(EndpointRole.WRITE, "postgresql://writer:pw@datastore/app"),
            endpoint(EndpointRole.READ, "postgresql://reader:pw@datastore/app"));

        assertDoesNotThrow(() -> validator.validate(endpoints, false));
    }

    @Test
    void testDebugSkipsCheck() {
        ResolvedEndpoints endpoints = new ResolvedEndpoints(
            endpoint(EndpointRole.CONTROL, "postgresql://app:pw@db/app"),
            endpoint(EndpointRole.WRITE, "postgresql://writer:pw@db/app"),
            endpoint(EndpointRole.READ, "postgresql://writer:pw@db/app"));

        assertDoesNotThrow(() -> validator.validate(endpoints, true));
    }

    @Test
    void testNoReadEndpointPasses() {
        ResolvedEndpoints endpoints = new ResolvedEndpoints(
            endpoint(EndpointRole.CONTROL, "postgresql://app:pw@db/app"),
            endpoint(EndpointRole.WRITE, "postgresql://app:pw@db/app"),
            null);

        assertDoesNotThrow(() -> validator.validate(endpoints, false));
    }
}
