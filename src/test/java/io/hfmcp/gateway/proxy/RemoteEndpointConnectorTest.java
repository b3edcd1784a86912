package io.hfmcp.gateway.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.client.RemoteToolException;
import io.hfmcp.gateway.client.RemoteToolProvider;
import io.hfmcp.gateway.client.SpaceVisibilityResolver;
import io.hfmcp.gateway.model.RemoteConnection;
import io.hfmcp.gateway.model.RemoteEndpoint;
import io.hfmcp.gateway.model.RemoteEndpoint.Visibility;
import io.hfmcp.gateway.protocol.ToolCallContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RemoteEndpointConnectorTest {

    private static final Duration TIMEOUT = Duration.ofMillis(400);

    private final ObjectMapper mapper = new ObjectMapper();
    private final CountDownLatch release = new CountDownLatch(1);
    private final Map<String, String> tokensSeen = new ConcurrentHashMap<>();
    private ExecutorService executor;
    private SpaceVisibilityResolver visibilityResolver;
    private RemoteEndpointConnector connector;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
        visibilityResolver = mock(SpaceVisibilityResolver.class);
        when(visibilityResolver.resolve(anyString(), any())).thenReturn(Visibility.PUBLIC);
        connector = new RemoteEndpointConnector(new FakeProvider(), visibilityResolver, new SchemaParser(mapper), executor, TIMEOUT);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    @Test
    void oneBlockingEndpointCostsOneTimeoutAndNothingElse() {
        List<RemoteEndpoint> endpoints = List.of(
            endpoint("owner/one"), endpoint("owner/slow"), endpoint("owner/two"), endpoint("owner/three"));

        long started = System.nanoTime();
        List<RemoteConnection> connections = connector.connect(endpoints, null);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(connections).hasSize(4);
        assertThat(connections).filteredOn(RemoteConnection::success).hasSize(3);
        RemoteConnection slow = connections.get(1);
        assertThat(slow.success()).isFalse();
        assertThat(slow.error()).contains("timeout");
        assertThat(elapsedMillis).isGreaterThanOrEqualTo(TIMEOUT.toMillis()).isLessThan(TIMEOUT.toMillis() * 5);
    }

    @Test
    void timedOutDiscoveriesReleaseTheirThreads() {
        ExecutorService small = Executors.newFixedThreadPool(2);
        try {
            RemoteEndpointConnector smallPool = new RemoteEndpointConnector(
                new FakeProvider(), visibilityResolver, new SchemaParser(mapper), small, TIMEOUT);

            List<RemoteConnection> dead = smallPool.connect(List.of(endpoint("owner/dead1"), endpoint("owner/dead2")), null);
            assertThat(dead).noneMatch(RemoteConnection::success);

            List<RemoteConnection> healthy = smallPool.connect(List.of(endpoint("owner/one")), null);
            assertThat(healthy).singleElement().satisfies(connection -> assertThat(connection.success()).isTrue());
        } finally {
            small.shutdownNow();
        }
    }

    @Test
    void queuedDiscoveryGetsItsOwnFullTimeout() {
        ExecutorService single = Executors.newFixedThreadPool(1);
        try {
            RemoteEndpointConnector singleThread = new RemoteEndpointConnector(
                new FakeProvider(), visibilityResolver, new SchemaParser(mapper), single, TIMEOUT);

            List<RemoteConnection> connections = singleThread.connect(List.of(
                endpoint("owner/dead1"), endpoint("owner/dead2"), endpoint("owner/one")), null);

            assertThat(connections).extracting(RemoteConnection::success).containsExactly(false, false, true);
            assertThat(connections.get(0).error()).contains("timeout");
            assertThat(connections.get(1).error()).contains("timeout");
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void ordinalsFollowCandidatePositions() {
        List<RemoteConnection> connections = connector.connect(List.of(
            endpoint("owner/one"),
            RemoteEndpoint.builder().id("x").name("no address").build(),
            endpoint("owner/two")), null);

        assertThat(connections).extracting(RemoteConnection::ordinal).containsExactly(1, 3);
    }

    @Test
    void schemaFailuresAreIsolated() {
        List<RemoteConnection> connections = connector.connect(List.of(
            endpoint("owner/empty"), endpoint("owner/broken"), endpoint("owner/one")), null);

        assertThat(connections.get(0).error()).isEqualTo(SchemaParseException.NO_TOOLS);
        assertThat(connections.get(1).error()).isEqualTo("connection refused");
        assertThat(connections.get(2).success()).isTrue();
    }

    @Test
    void tokenIsSentOnlyToPrivateEndpoints() {
        when(visibilityResolver.resolve(eq("owner/secret"), any())).thenReturn(Visibility.PRIVATE);

        List<RemoteConnection> connections = connector.connect(List.of(endpoint("owner/one"), endpoint("owner/secret")), "hf_token");

        assertThat(tokensSeen).containsEntry("owner-secret", "hf_token").containsEntry("owner-one", "none");
        assertThat(connections.get(1).endpoint().visibility()).isEqualTo(Visibility.PRIVATE);
    }

    private static RemoteEndpoint endpoint(String name) {
        String subdomain = name.replace('/', '-');
        return RemoteEndpoint.builder().id("gradio_" + subdomain).name(name).subdomain(subdomain).build();
    }

    private class FakeProvider implements RemoteToolProvider {

        @Override
        public JsonNode fetchSchema(RemoteEndpoint endpoint, String token) {
            tokensSeen.put(endpoint.subdomain(), token == null ? "none" : token);
            try {
                return switch (endpoint.name()) {
                    case "owner/slow", "owner/dead1", "owner/dead2", "owner/dead3" -> {
                        release.await(10, TimeUnit.SECONDS);
                        yield mapper.readTree("[]");
                    }
                    case "owner/empty" -> mapper.readTree("[]");
                    case "owner/broken" -> throw new RemoteToolException("connection refused");
                    default -> mapper.readTree("{\"predict\":{\"properties\":{\"text\":{\"type\":\"string\"}}}}");
                };
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RemoteToolException("interrupted", e);
            } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
                throw new RemoteToolException("bad json", e);
            }
        }

        @Override
        public Map<String, Object> callTool(RemoteEndpoint endpoint, String toolName, Map<String, Object> arguments,
                                            String token, ToolCallContext context) {
            throw new UnsupportedOperationException();
        }
    }
}
