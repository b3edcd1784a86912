package io.hfmcp.gateway.metrics;

import io.hfmcp.gateway.model.ClientInfo;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counters describing the health and usage of the active transport.
 *
 * <p>All counters are safe to update from any thread. Readers take a {@link Snapshot}.</p>
 */
public class TransportMetrics {

    private final Clock clock;
    private final Instant startedAt;

    private final AtomicInteger activeConnections = new AtomicInteger();
    private final AtomicLong totalConnections = new AtomicLong();
    private final AtomicLong cleanedConnections = new AtomicLong();

    private final AtomicLong totalRequests = new AtomicLong();

    private final AtomicLong expectedErrors = new AtomicLong();
    private final AtomicLong unexpectedErrors = new AtomicLong();
    private final AtomicReference<LastError> lastError = new AtomicReference<>();

    private final AtomicLong pingsSent = new AtomicLong();
    private final AtomicLong pingsSuccessful = new AtomicLong();
    private final AtomicLong pingsFailed = new AtomicLong();
    private final AtomicReference<Instant> lastPingTime = new AtomicReference<>();

    private final AtomicLong staticPageHits200 = new AtomicLong();
    private final AtomicLong staticPageHits405 = new AtomicLong();

    private final Map<String, ClientStats> clients = new ConcurrentHashMap<>();
    private final Map<String, MethodStats> methods = new ConcurrentHashMap<>();

    public TransportMetrics(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void trackRequest() {
        totalRequests.incrementAndGet();
    }

    public void trackNewConnection() {
        totalConnections.incrementAndGet();
    }

    public void updateActiveConnections(int active) {
        activeConnections.set(active);
    }

    /**
     * Count one session evicted by the stale sweep.
     */
    public void trackSessionCleaned() {
        cleanedConnections.incrementAndGet();
    }

    /**
     * Record a failed request. Status codes below 500 count as expected client errors.
     */
    public void trackError(int status, String type, String message) {
        if (status >= 400 && status < 500) {
            expectedErrors.incrementAndGet();
        } else {
            unexpectedErrors.incrementAndGet();
        }
        lastError.set(new LastError(type, message, clock.instant()));
    }

    public void trackError(int status, Throwable error) {
        trackError(status, error.getClass().getSimpleName(), error.getMessage());
    }

    public void trackPingSent() {
        pingsSent.incrementAndGet();
        lastPingTime.set(clock.instant());
    }

    public void trackPingSuccess() {
        pingsSuccessful.incrementAndGet();
    }

    public void trackPingFailed() {
        pingsFailed.incrementAndGet();
    }

    public void trackStaticPageHit(int status) {
        if (status == 200) {
            staticPageHits200.incrementAndGet();
        } else if (status == 405) {
            staticPageHits405.incrementAndGet();
        }
    }

    /**
     * Record one handled MCP method.
     *
     * @param method method name, {@code tools/call} is suffixed with the tool name
     * @param elapsed handling time
     * @param error whether the method failed
     */
    public void trackMethod(String method, Duration elapsed, boolean error) {
        methods.computeIfAbsent(method, m -> new MethodStats(clock.instant()))
            .record(clock.instant(), elapsed, error);
    }

    public void clientConnected(ClientInfo client) {
        if (client != null) {
            clients.computeIfAbsent(client.key(), k -> new ClientStats(client, clock.instant()))
                .connected(clock.instant());
        }
    }

    public void clientDisconnected(ClientInfo client) {
        if (client != null) {
            ClientStats stats = clients.get(client.key());
            if (stats != null) {
                stats.disconnected();
            }
        }
    }

    public void clientActivity(ClientInfo client) {
        if (client != null) {
            clients.computeIfAbsent(client.key(), k -> new ClientStats(client, clock.instant()))
                .activity(clock.instant());
        }
    }

    public Snapshot snapshot() {
        Instant now = clock.instant();
        long requests = totalRequests.get();
        double minutes = Math.max(1.0, Duration.between(startedAt, now).toMillis() / 60_000.0);

        Map<String, ClientSnapshot> clientSnapshots = new TreeMap<>();
        clients.forEach((key, stats) -> clientSnapshots.put(key, stats.snapshot()));
        Map<String, MethodSnapshot> methodSnapshots = new TreeMap<>();
        methods.forEach((name, stats) -> methodSnapshots.put(name, stats.snapshot()));

        return new Snapshot(
            startedAt,
            new Connections(activeConnections.get(), totalConnections.get(), cleanedConnections.get()),
            new Requests(requests, requests / minutes),
            new Errors(expectedErrors.get(), unexpectedErrors.get(), lastError.get()),
            new Pings(pingsSent.get(), pingsSuccessful.get(), pingsFailed.get(), lastPingTime.get()),
            clientSnapshots,
            methodSnapshots,
            new StaticPageHits(staticPageHits200.get(), staticPageHits405.get()));
    }

    public record Snapshot(
        Instant startedAt,
        Connections connections,
        Requests requests,
        Errors errors,
        Pings pings,
        Map<String, ClientSnapshot> clients,
        Map<String, MethodSnapshot> methods,
        StaticPageHits staticPageHits
    ) {
    }

    public record Connections(int active, long total, long cleaned) {
    }

    public record Requests(long total, double averagePerMinute) {
    }

    public record Errors(long expected, long unexpected, LastError lastError) {
    }

    public record LastError(String type, String message, Instant timestamp) {
    }

    public record Pings(long sent, long successful, long failed, Instant lastPingTime) {
    }

    public record StaticPageHits(long status200, long status405) {
    }

    public record ClientSnapshot(
        String name,
        String version,
        long requestCount,
        Instant firstSeen,
        Instant lastSeen,
        boolean isConnected,
        int activeConnections,
        long totalConnections
    ) {
    }

    public record MethodSnapshot(
        long count,
        Instant firstCalled,
        Instant lastCalled,
        double averageResponseTime,
        long errors,
        double errorRate
    ) {
    }

    private static final class ClientStats {
        private final ClientInfo client;
        private final Instant firstSeen;
        private Instant lastSeen;
        private long requestCount;
        private int activeConnections;
        private long totalConnections;

        ClientStats(ClientInfo client, Instant firstSeen) {
            this.client = client;
            this.firstSeen = firstSeen;
            this.lastSeen = firstSeen;
        }

        synchronized void connected(Instant now) {
            activeConnections++;
            totalConnections++;
            lastSeen = now;
        }

        synchronized void disconnected() {
            activeConnections = Math.max(0, activeConnections - 1);
        }

        synchronized void activity(Instant now) {
            requestCount++;
            lastSeen = now;
        }

        synchronized ClientSnapshot snapshot() {
            return new ClientSnapshot(client.name(), client.version(), requestCount, firstSeen, lastSeen,
                activeConnections > 0, activeConnections, totalConnections);
        }
    }

    private static final class MethodStats {
        private final Instant firstCalled;
        private Instant lastCalled;
        private long count;
        private long errors;
        private long successCount;
        private long successMillis;

        MethodStats(Instant firstCalled) {
            this.firstCalled = firstCalled;
            this.lastCalled = firstCalled;
        }

        synchronized void record(Instant now, Duration elapsed, boolean error) {
            count++;
            lastCalled = now;
            if (error) {
                errors++;
            } else {
                successCount++;
                successMillis += elapsed.toMillis();
            }
        }

        synchronized MethodSnapshot snapshot() {
            double average = successCount == 0 ? 0.0 : (double) successMillis / successCount;
            double errorRate = count == 0 ? 0.0 : (double) errors / count;
            return new MethodSnapshot(count, firstCalled, lastCalled, average, errors, errorRate);
        }
    }
}
