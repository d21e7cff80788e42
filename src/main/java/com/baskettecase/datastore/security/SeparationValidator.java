package com.baskettecase.datastore.security;

import com.baskettecase.datastore.db.ConnectionEndpoint;
import com.baskettecase.datastore.db.ResolvedEndpoints;
import com.baskettecase.datastore.error.DatastoreConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Separation Validator
 *
 * Makes sure the datastore is on a separate database. The read-only user is granted SELECT on
 * everything in its database, so sharing a database with the application would expose all
 * internal tables through the API.
 *
 * <ul>
 *   <li>write and read must not be the same user on the same database</li>
 *   <li>control and read must not be the same database, whatever the users</li>
 * </ul>
 */
@Slf4j
@Component
public class SeparationValidator {

    /**
     * Validate endpoint separation. Does nothing without a read endpoint.
     *
     * @param endpoints resolved endpoints
     * @param debug explicit bypass flag; when set the check is skipped with a warning
     */
    public void validate(ResolvedEndpoints endpoints, boolean debug) {
        if (!endpoints.hasReadEndpoint()) {
            log.debug("No read endpoint configured, nothing to separate");
            return;
        }
        if (debug) {
            log.warn("⚠️ Debug mode: skipping datastore separation check");
            return;
        }

        ConnectionEndpoint write = endpoints.write();
        ConnectionEndpoint read = endpoints.read();

        if (write.identity().equals(read.identity())
                && Objects.equals(write.principal(), read.principal())) {
            throw new DatastoreConfigurationException(
                "The write and read-only database connection url are the same.");
        }

        ConnectionEndpoint control = endpoints.control();
        if (control != null && control.identity().equals(read.identity())) {
            throw new DatastoreConfigurationException(
                "The control and datastore database are the same: " + read.identity());
        }

        log.info("✅ Datastore endpoints are separated (read={})", read.identity());
    }
}
