package io.hfmcp.gateway.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SessionMetadataTest {

    private static final Instant CONNECTED = Instant.parse("2025-03-01T10:00:00Z");

    @Test
    void lastActivityNeverMovesBackwards() {
        SessionMetadata metadata = new SessionMetadata("s1", TransportType.SSE, CONNECTED);

        metadata.touch(CONNECTED.plusSeconds(30));
        metadata.touch(CONNECTED.plusSeconds(10));
        metadata.touch(CONNECTED.minusSeconds(10));

        assertThat(metadata.lastActivity()).isEqualTo(CONNECTED.plusSeconds(30));
        assertThat(metadata.idleTime(CONNECTED.plusSeconds(90))).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void snapshotCarriesClientAndStatus() {
        SessionMetadata metadata = new SessionMetadata("s1", TransportType.STREAMABLE_HTTP, CONNECTED);
        metadata.updateClient(new ClientInfo("claude-ai", "0.1"), true, false);
        metadata.updateStatus(SessionMetadata.Status.DISTRESSED);

        SessionInfo info = metadata.snapshot();

        assertThat(info.id()).isEqualTo("s1");
        assertThat(info.transport()).isEqualTo(TransportType.STREAMABLE_HTTP);
        assertThat(info.clientInfo()).isEqualTo(new ClientInfo("claude-ai", "0.1"));
        assertThat(info.sampling()).isTrue();
        assertThat(info.roots()).isFalse();
        assertThat(info.status()).isEqualTo(SessionMetadata.Status.DISTRESSED);
        assertThat(info.lastActivity()).isEqualTo(CONNECTED);
    }
}
