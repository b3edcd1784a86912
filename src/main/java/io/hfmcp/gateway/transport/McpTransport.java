package io.hfmcp.gateway.transport;

import io.hfmcp.gateway.model.SessionInfo;
import io.hfmcp.gateway.model.TransportType;

import java.util.List;

/**
 * A channel over which MCP clients reach the gateway.
 *
 * <p>Stateful transports own a session per client; the stateless transport builds a fresh
 * server for every request and reports {@link #STATELESS_MODE} as its connection count.</p>
 */
public interface McpTransport {

    int STATELESS_MODE = -1;

    TransportType type();

    /**
     * Start background work (stale sweeps, heartbeats, the stdin reader).
     *
     * @param options listeners supplied by the hosting application
     */
    void initialize(TransportOptions options);

    /**
     * Stop accepting new sessions. Existing sessions keep working until {@link #cleanup()}.
     */
    void shutdown();

    /**
     * Close every session and cancel background work. Safe to call more than once.
     */
    void cleanup();

    int getActiveConnectionCount();

    List<SessionInfo> getSessions();

    boolean isAcceptingConnections();
}
