package io.hfmcp.gateway.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Server-side state for one logical client connection.
 *
 * <p>Created at handshake and touched on every request. {@code lastActivity} never moves
 * backwards and never precedes {@code connectedAt}.</p>
 */
public class SessionMetadata {

    /**
     * Connection status of a session.
     */
    public enum Status {
        CONNECTED,
        DISTRESSED,
        CLOSED
    }

    private final String id;
    private final TransportType transport;
    private final Instant connectedAt;
    private Instant lastActivity;
    private ClientInfo clientInfo;
    private boolean sampling;
    private boolean roots;
    private Status status = Status.CONNECTED;

    public SessionMetadata(String id, TransportType transport, Instant connectedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.connectedAt = Objects.requireNonNull(connectedAt, "connectedAt");
        this.lastActivity = connectedAt;
    }

    public String id() {
        return id;
    }

    public TransportType transport() {
        return transport;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public synchronized Instant lastActivity() {
        return lastActivity;
    }

    public synchronized ClientInfo clientInfo() {
        return clientInfo;
    }

    public synchronized Status status() {
        return status;
    }

    /**
     * Record activity at the given instant. Earlier instants are ignored.
     */
    public synchronized void touch(Instant now) {
        if (now.isAfter(lastActivity)) {
            lastActivity = now;
        }
    }

    public synchronized void updateClient(ClientInfo clientInfo, boolean sampling, boolean roots) {
        this.clientInfo = clientInfo;
        this.sampling = sampling;
        this.roots = roots;
    }

    public synchronized void updateStatus(Status status) {
        this.status = status;
    }

    /**
     * Time elapsed since the last recorded activity.
     */
    public synchronized Duration idleTime(Instant now) {
        return Duration.between(lastActivity, now);
    }

    public synchronized SessionInfo snapshot() {
        return new SessionInfo(id, transport, connectedAt, lastActivity, clientInfo, sampling, roots, status);
    }
}
