package io.hfmcp.gateway.model;

import java.time.Instant;

/**
 * Immutable snapshot of a session, safe to hand out to metrics readers.
 */
public record SessionInfo(
    String id,
    TransportType transport,
    Instant connectedAt,
    Instant lastActivity,
    ClientInfo clientInfo,
    boolean sampling,
    boolean roots,
    SessionMetadata.Status status
) {
}
