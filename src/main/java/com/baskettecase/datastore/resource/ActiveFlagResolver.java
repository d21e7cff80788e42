package com.baskettecase.datastore.resource;

import com.baskettecase.datastore.error.UnexpectedDatabaseException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Active Flag Resolver
 *
 * Adds {@code datastore_active} to a resource description: true when the write endpoint has a table
 * named after the resource id. The flag is looked up on every call and never cached.
 *
 * Callers compose this with the platform's describe operation explicitly:
 * <pre>{@code
 * ResourceDescriptor resource = resolver.describeWithActiveFlag(id, platform::describeResource);
 * }</pre>
 */
@Slf4j
@Service
public class ActiveFlagResolver {

    private static final String TABLE_EXISTS_SQL = "SELECT 1 FROM pg_tables WHERE tablename = ?";

    private final JdbcTemplate jdbcTemplate;
    private final Timer lookupTimer;

    public ActiveFlagResolver(@Qualifier("writeJdbcTemplate") JdbcTemplate jdbcTemplate,
                              MeterRegistry meterRegistry) {
        this.jdbcTemplate = jdbcTemplate;
        this.lookupTimer = Timer.builder("datastore.active_flag.lookup")
            .description("Time taken to check whether a resource has a datastore table")
            .register(meterRegistry);
    }

    /**
     * Describe a resource and flag whether it is backed by a datastore table.
     * Failures of {@code underlyingDescribe} propagate unchanged.
     *
     * @throws UnexpectedDatabaseException if the catalog lookup fails
     */
    public ResourceDescriptor describeWithActiveFlag(String resourceId, ResourceDescriber underlyingDescribe) {
        ResourceDescriptor descriptor = Objects.requireNonNull(
            underlyingDescribe.describe(resourceId),
            "describe returned no resource for " + resourceId);

        boolean active = isDatastoreActive(resourceId);
        log.debug("Resource {} datastore_active={}", resourceId, active);
        return descriptor.withDatastoreActive(active);
    }

    /**
     * Whether a table with this name exists on the write endpoint
     */
    public boolean isDatastoreActive(String resourceId) {
        Timer.Sample sample = Timer.start();
        try {
            return !jdbcTemplate.queryForList(TABLE_EXISTS_SQL, Integer.class, resourceId).isEmpty();
        } catch (DataAccessException e) {
            throw new UnexpectedDatabaseException(
                "Failed to look up datastore table for resource " + resourceId, e);
        } finally {
            sample.stop(lookupTimer);
        }
    }
}
