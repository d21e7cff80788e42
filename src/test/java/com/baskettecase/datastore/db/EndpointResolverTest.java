package com.baskettecase.datastore.db;

import com.baskettecase.datastore.config.DatastoreProperties;
import com.baskettecase.datastore.error.DatastoreConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EndpointResolver
 */
class EndpointResolverTest {

    private EndpointResolver resolver;
    private DatastoreProperties properties;

    @BeforeEach
    void setUp() {
        resolver = new EndpointResolver();
        properties = new DatastoreProperties();
    }

    @Test
    void testMissingWriteUrlFails() {
        properties.setReadUrl("postgresql://reader:pw@db/datastore");

        DatastoreConfigurationException e = assertThrows(DatastoreConfigurationException.class,
            () -> resolver.resolve(properties));
        assertTrue(e.getMessage().contains("write-url"));
    }

    @Test
    void testResolvesAllEndpoints() {
        properties.setControlUrl("postgresql://app:pw@db/app");
        properties.setWriteUrl("postgresql://writer:pw@db/datastore");
        properties.setReadUrl("postgresql://reader:pw@db/datastore");

        ResolvedEndpoints endpoints = resolver.resolve(properties);

        assertEquals(EndpointRole.CONTROL, endpoints.control().role());
        assertEquals(EndpointRole.WRITE, endpoints.write().role());
        assertEquals(EndpointRole.READ, endpoints.read().role());
        assertEquals("app", endpoints.control().identity().database());
        assertEquals("reader", endpoints.read().principal());
        assertTrue(endpoints.hasReadEndpoint());
    }

    @Test
    void testBlankReadUrlMeansNoReadEndpoint() {
        properties.setWriteUrl("postgresql://writer:pw@db/datastore");
        properties.setReadUrl("");

        ResolvedEndpoints endpoints = resolver.resolve(properties);

        assertFalse(endpoints.hasReadEndpoint());
        assertTrue(endpoints.readEndpoint().isEmpty());
        assertTrue(endpoints.controlEndpoint().isEmpty());
    }

    @Test
    void testInvalidReadUrlNamesTheRole() {
        properties.setWriteUrl("postgresql://writer:pw@db/datastore");
        properties.setReadUrl("not a url");

        DatastoreConfigurationException e = assertThrows(DatastoreConfigurationException.class,
            () -> resolver.resolve(properties));
        assertTrue(e.getMessage().startsWith("Invalid read connection url"));
    }
}
