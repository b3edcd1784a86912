package io.hfmcp.gateway.metrics;

import io.hfmcp.gateway.MutableClock;
import io.hfmcp.gateway.model.ClientInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TransportMetricsTest {

    private MutableClock clock;
    private TransportMetrics metrics;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        metrics = new TransportMetrics(clock);
    }

    @Test
    void methodStatsAverageOnlySuccessfulCalls() {
        metrics.trackMethod("tools/call:model_search", Duration.ofMillis(100), false);
        metrics.trackMethod("tools/call:model_search", Duration.ofMillis(300), false);
        clock.advance(Duration.ofSeconds(5));
        metrics.trackMethod("tools/call:model_search", Duration.ofMillis(9000), true);

        TransportMetrics.MethodSnapshot snapshot = metrics.snapshot().methods().get("tools/call:model_search");
        assertThat(snapshot.count()).isEqualTo(3);
        assertThat(snapshot.errors()).isEqualTo(1);
        assertThat(snapshot.averageResponseTime()).isEqualTo(200.0);
        assertThat(snapshot.errorRate()).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(snapshot.lastCalled()).isEqualTo(clock.instant());
    }

    @Test
    void clientErrorsAreExpectedServerErrorsAreNot() {
        metrics.trackError(400, "BadRequest", "missing session");
        metrics.trackError(404, "NotFound", "gone");
        metrics.trackError(500, new IllegalStateException("boom"));

        TransportMetrics.Errors errors = metrics.snapshot().errors();
        assertThat(errors.expected()).isEqualTo(2);
        assertThat(errors.unexpected()).isEqualTo(1);
        assertThat(errors.lastError().type()).isEqualTo("IllegalStateException");
        assertThat(errors.lastError().message()).isEqualTo("boom");
    }

    @Test
    void clientConnectionsAreAggregatedByIdentity() {
        ClientInfo client = new ClientInfo("inspector", "1.0");
        metrics.clientConnected(client);
        metrics.clientConnected(new ClientInfo("inspector", "1.0"));
        metrics.clientActivity(client);
        metrics.clientDisconnected(client);

        TransportMetrics.ClientSnapshot snapshot = metrics.snapshot().clients().get("inspector 1.0");
        assertThat(snapshot.totalConnections()).isEqualTo(2);
        assertThat(snapshot.activeConnections()).isEqualTo(1);
        assertThat(snapshot.isConnected()).isTrue();
        assertThat(snapshot.requestCount()).isEqualTo(1);

        metrics.clientDisconnected(client);
        metrics.clientDisconnected(client);
        assertThat(metrics.snapshot().clients().get("inspector 1.0").activeConnections()).isZero();
    }

    @Test
    void requestRateUsesAtLeastOneMinute() {
        metrics.trackRequest();
        metrics.trackRequest();
        assertThat(metrics.snapshot().requests().averagePerMinute()).isEqualTo(2.0);

        clock.advance(Duration.ofMinutes(4));
        assertThat(metrics.snapshot().requests().averagePerMinute()).isEqualTo(0.5);
    }

    @Test
    void connectionsPingsAndPageHitsAreCounted() {
        metrics.trackNewConnection();
        metrics.trackNewConnection();
        metrics.updateActiveConnections(1);
        metrics.trackSessionCleaned();
        metrics.trackPingSent();
        metrics.trackPingSuccess();
        metrics.trackPingSent();
        metrics.trackPingFailed();
        metrics.trackStaticPageHit(200);
        metrics.trackStaticPageHit(405);
        metrics.trackStaticPageHit(405);

        TransportMetrics.Snapshot snapshot = metrics.snapshot();
        assertThat(snapshot.connections()).isEqualTo(new TransportMetrics.Connections(1, 2, 1));
        assertThat(snapshot.pings().sent()).isEqualTo(2);
        assertThat(snapshot.pings().successful()).isEqualTo(1);
        assertThat(snapshot.pings().failed()).isEqualTo(1);
        assertThat(snapshot.pings().lastPingTime()).isEqualTo(clock.instant());
        assertThat(snapshot.staticPageHits()).isEqualTo(new TransportMetrics.StaticPageHits(1, 2));
    }
}
