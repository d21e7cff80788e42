package com.baskettecase.datastore.db;

import java.util.Optional;

/**
 * The endpoints the datastore guard was configured with. Produced once by
 * {@link EndpointResolver}; the write endpoint is always present.
 */
public record ResolvedEndpoints(ConnectionEndpoint control, ConnectionEndpoint write, ConnectionEndpoint read) {

    Optional<ConnectionEndpoint> controlEndpoint() {
        return Optional.ofNullable(control);
    }

    public Optional<ConnectionEndpoint> readEndpoint() {
        return Optional.ofNullable(read);
    }

    public boolean hasReadEndpoint() {
        return read != null;
    }
}
