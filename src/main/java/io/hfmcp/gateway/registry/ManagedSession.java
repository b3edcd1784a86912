package io.hfmcp.gateway.registry;

import io.hfmcp.gateway.model.SessionMetadata;

/**
 * A session owned by a stateful transport: its metadata plus the resources to release on close.
 */
public interface ManagedSession {

    SessionMetadata metadata();

    /**
     * Release the session's server instance and streams.
     *
     * @throws Exception if a resource fails to close
     */
    void close() throws Exception;
}
