package io.hfmcp.gateway.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.GatewayContext;
import io.hfmcp.gateway.MutableClock;
import io.hfmcp.gateway.model.TransportType;
import io.hfmcp.gateway.protocol.McpHeaders;
import io.hfmcp.gateway.server.AugmentationPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StatelessHttpTransportTest {

    private static final String BROWSER_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private GatewayContext context;
    private RecordingServerFactory serverFactory;

    @BeforeEach
    void setUp() {
        context = GatewayContext.create(TransportType.STATELESS_HTTP, MutableClock.startingAt("2025-01-01T00:00:00Z"));
        serverFactory = new RecordingServerFactory();
    }

    @Test
    void everyRequestGetsItsOwnServerWhichIsClosedAfterwards() {
        StatelessHttpTransport transport = transport(false);

        ResponseEntity<Object> first = transport.handlePost(Map.of(), RecordingServerFactory.initialize(1));
        ResponseEntity<Object> second = transport.handlePost(Map.of(), RecordingServerFactory.echo(2, "hi"));

        assertThat(first.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(second.getBody()).asString().contains("hi");
        assertThat(serverFactory.servers).hasSize(2).allSatisfy(server -> assertThat(server.isClosed()).isTrue());
        assertThat(transport.getActiveConnectionCount()).isEqualTo(McpTransport.STATELESS_MODE);
        assertThat(transport.getSessions()).isEmpty();
    }

    @Test
    void handshakeAndLocalToolCallsSkipAugmentation() {
        StatelessHttpTransport transport = transport(false);

        transport.handlePost(Map.of(), RecordingServerFactory.initialize(1));
        transport.handlePost(Map.of(), RecordingServerFactory.echo(2, "local"));
        transport.handlePost(Map.of(), "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/call\",\"params\":{\"name\":\"gr1_flux\"}}");
        transport.handlePost(Map.of(), "{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"tools/list\"}");

        assertThat(serverFactory.requests).extracting(request -> request.augmentation()).containsExactly(
            AugmentationPolicy.NEVER, AugmentationPolicy.NEVER, AugmentationPolicy.ALWAYS, AugmentationPolicy.ALWAYS);
    }

    @Test
    void otherMethodsUseStubServer() {
        StatelessHttpTransport transport = transport(false);

        ResponseEntity<Object> response = transport.handlePost(Map.of(), "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(serverFactory.requests).isEmpty();
    }

    @Test
    void notificationsAreAcceptedWithoutAServer() {
        ResponseEntity<Object> response = transport(false).handlePost(Map.of(),
            "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(serverFactory.servers).isEmpty();
    }

    @Test
    void browserGetServesWelcomePage() {
        StatelessHttpTransport transport = transport(false);

        ResponseEntity<Object> response = transport.handleGet(Map.of(McpHeaders.ACCEPT, BROWSER_ACCEPT));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.TEXT_HTML);
        assertThat(response.getBody()).asString().contains("<html");
        assertThat(context.transportMetrics().snapshot().staticPageHits().status200()).isEqualTo(1);
    }

    @Test
    void nonBrowserGetIsMethodNotAllowed() {
        ResponseEntity<Object> response = transport(false).handleGet(Map.of(McpHeaders.ACCEPT, "application/json, text/event-stream"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
        assertThat(context.transportMetrics().snapshot().staticPageHits().status405()).isEqualTo(1);
    }

    @Test
    void strictComplianceRejectsBrowsersToo() {
        ResponseEntity<Object> response = transport(true).handleGet(Map.of(McpHeaders.ACCEPT, BROWSER_ACCEPT));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
    }

    @Test
    void deleteIsAlwaysMethodNotAllowed() {
        assertThat(transport(false).handleDelete().getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
    }

    private StatelessHttpTransport transport(boolean strict) {
        StatelessHttpTransport transport = new StatelessHttpTransport(serverFactory, context, new ObjectMapper(),
            strict, "hf-mcp-gateway", "test");
        transport.initialize(TransportOptions.defaults());
        return transport;
    }
}
