package com.baskettecase.datastore.db;

import com.baskettecase.datastore.config.DatastoreProperties;
import com.baskettecase.datastore.error.DatastoreConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Endpoint Resolver
 *
 * Turns the configured connection urls into {@link ConnectionEndpoint}s that can be compared
 * by the database they target. The write url is mandatory; control and read are optional,
 * and a key that is present but blank counts as not configured.
 */
@Slf4j
@Component
public class EndpointResolver {

    public ResolvedEndpoints resolve(DatastoreProperties properties) {
        if (isBlank(properties.getWriteUrl())) {
            throw new DatastoreConfigurationException("datastore.write-url not found in config");
        }

        ConnectionEndpoint write = resolve(EndpointRole.WRITE, properties.getWriteUrl());
        ConnectionEndpoint control = isBlank(properties.getControlUrl())
            ? null
            : resolve(EndpointRole.CONTROL, properties.getControlUrl());
        ConnectionEndpoint read = isBlank(properties.getReadUrl())
            ? null
            : resolve(EndpointRole.READ, properties.getReadUrl());

        log.info("🔗 Resolved datastore endpoints: control={}, write={}, read={}",
            control != null ? control.identity() : "<none>",
            write.identity(),
            read != null ? read.identity() : "<none>");

        return new ResolvedEndpoints(control, write, read);
    }

    private ConnectionEndpoint resolve(EndpointRole role, String url) {
        try {
            Dsn dsn = Dsn.parse(url);
            return new ConnectionEndpoint(role, dsn.identity(), dsn);
        } catch (DatastoreConfigurationException e) {
            throw new DatastoreConfigurationException(
                "Invalid " + role.name().toLowerCase(Locale.ROOT) + " connection url: " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
