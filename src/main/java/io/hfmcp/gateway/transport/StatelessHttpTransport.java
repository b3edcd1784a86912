package io.hfmcp.gateway.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.GatewayContext;
import io.hfmcp.gateway.metrics.TransportMetrics;
import io.hfmcp.gateway.model.SessionInfo;
import io.hfmcp.gateway.model.TransportType;
import io.hfmcp.gateway.protocol.JsonRpcErrors;
import io.hfmcp.gateway.protocol.JsonRpcMessage;
import io.hfmcp.gateway.protocol.McpProtocolException;
import io.hfmcp.gateway.protocol.McpServerInstance;
import io.hfmcp.gateway.protocol.NotificationSink;
import io.hfmcp.gateway.proxy.ToolNameGenerator;
import io.hfmcp.gateway.server.AugmentationPolicy;
import io.hfmcp.gateway.server.ServerFactory;
import io.hfmcp.gateway.server.ServerRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * MCP over HTTP without sessions: every POST gets a server instance of its own, closed once the
 * request completes.
 */
public class StatelessHttpTransport implements McpTransport {

    private static final Logger log = LoggerFactory.getLogger(StatelessHttpTransport.class);

    static final String WELCOME_PAGE = "web/mcp-welcome.html";

    static final Set<String> FULL_SERVER_METHODS =
        Set.of("initialize", "tools/list", "tools/call", "prompts/list", "prompts/get");

    private static final String FALLBACK_PAGE =
        "<!DOCTYPE html><html><body><h1>MCP endpoint</h1><p>POST JSON-RPC messages to this URL.</p></body></html>";

    private final ServerFactory serverFactory;
    private final TransportMetrics metrics;
    private final ObjectMapper objectMapper;
    private final boolean strictCompliance;
    private final String serverName;
    private final String serverVersion;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private volatile TransportOptions options = TransportOptions.defaults();
    private volatile String welcomePage;

    public StatelessHttpTransport(ServerFactory serverFactory,
                                  GatewayContext context,
                                  ObjectMapper objectMapper,
                                  boolean strictCompliance,
                                  String serverName,
                                  String serverVersion) {
        this.serverFactory = serverFactory;
        this.metrics = context.transportMetrics();
        this.objectMapper = objectMapper;
        this.strictCompliance = strictCompliance;
        this.serverName = serverName;
        this.serverVersion = serverVersion;
    }

    @Override
    public TransportType type() {
        return TransportType.STATELESS_HTTP;
    }

    @Override
    public void initialize(TransportOptions options) {
        this.options = options != null ? options : TransportOptions.defaults();
        metrics.updateActiveConnections(STATELESS_MODE);
        log.info("Initialized stateless-http transport (strict compliance: {})", strictCompliance);
    }

    /**
     * Handle one POSTed JSON-RPC message with a request-scoped server.
     */
    public ResponseEntity<Object> handlePost(Map<String, String> headers, String body) {
        metrics.trackRequest();
        JsonRpcMessage message;
        try {
            message = JsonRpcMessage.parse(objectMapper, body);
        } catch (McpProtocolException e) {
            metrics.trackError(400, "ParseError", e.getMessage());
            return ResponseEntity.badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(JsonRpcErrors.error(null, e.getCode(), e.getMessage()));
        }
        if (!message.isRequest()) {
            log.debug("Accepted {} without a response", message.isNotification() ? message.method() : "response");
            return ResponseEntity.accepted().build();
        }
        if (shuttingDown.get()) {
            metrics.trackError(503, "ShuttingDown", "Rejected request during shutdown");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .contentType(MediaType.APPLICATION_JSON)
                .body(JsonRpcErrors.serverShuttingDown(message.id()));
        }

        McpServerInstance server = null;
        long started = System.nanoTime();
        boolean error = false;
        try {
            server = createServer(headers, message);
            Optional<Map<String, Object>> response = server.handle(message, NotificationSink.DISCARD);
            error = response.map(r -> r.containsKey("error")).orElse(false);
            if (response.isEmpty()) {
                return ResponseEntity.accepted().build();
            }
            return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(response.get());
        } catch (RuntimeException e) {
            error = true;
            log.error("Error handling {}: {}", message.method(), e.getMessage(), e);
            metrics.trackError(500, e);
            return ResponseEntity.internalServerError()
                .contentType(MediaType.APPLICATION_JSON)
                .body(JsonRpcErrors.internalError(message.id()));
        } finally {
            metrics.trackMethod(message.trackingKey(), Duration.ofNanos(System.nanoTime() - started), error);
            if (server != null) {
                server.close();
            }
        }
    }

    /**
     * Serve the welcome page to browsers, 405 to everyone else or under strict compliance.
     */
    public ResponseEntity<Object> handleGet(Map<String, String> headers) {
        metrics.trackRequest();
        if (strictCompliance || !BrowserDetection.isBrowser(headers)) {
            metrics.trackStaticPageHit(405);
            return methodNotAllowed();
        }
        metrics.trackStaticPageHit(200);
        return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(welcomePage());
    }

    public ResponseEntity<Object> handleDelete() {
        metrics.trackRequest();
        return methodNotAllowed();
    }

    private ResponseEntity<Object> methodNotAllowed() {
        metrics.trackError(405, "MethodNotAllowed", "Method not allowed in stateless mode");
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
            .header(HttpHeaders.ALLOW, HttpMethod.POST.name())
            .contentType(MediaType.APPLICATION_JSON)
            .body(JsonRpcErrors.methodNotAllowed("Method not allowed."));
    }

    private McpServerInstance createServer(Map<String, String> headers, JsonRpcMessage message) {
        if (!FULL_SERVER_METHODS.contains(message.method())) {
            return McpServerInstance.builder()
                .serverInfo(serverName, serverVersion)
                .build();
        }
        AugmentationPolicy policy = skipsAugmentation(message) ? AugmentationPolicy.NEVER : AugmentationPolicy.ALWAYS;
        return serverFactory.create(ServerRequest.of(headers, policy, (clientInfo, sampling, roots) -> {
            metrics.clientActivity(clientInfo);
            options.clientInfoListener().onInitialized(clientInfo, sampling, roots);
        }));
    }

    /**
     * The handshake and calls of local tools need no remote endpoints.
     */
    static boolean skipsAugmentation(JsonRpcMessage message) {
        if ("initialize".equals(message.method())) {
            return true;
        }
        if ("tools/call".equals(message.method())) {
            Object name = message.params().get("name");
            return !(name instanceof String toolName) || !ToolNameGenerator.isProxyToolName(toolName);
        }
        return false;
    }

    private String welcomePage() {
        String page = welcomePage;
        if (page == null) {
            try (InputStream in = new ClassPathResource(WELCOME_PAGE).getInputStream()) {
                page = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("Could not load {}: {}", WELCOME_PAGE, e.getMessage());
                page = FALLBACK_PAGE;
            }
            welcomePage = page;
        }
        return page;
    }

    @Override
    public void shutdown() {
        shuttingDown.set(true);
    }

    @Override
    public void cleanup() {
        shutdown();
        log.debug("stateless-http transport holds no sessions to clean up");
    }

    @Override
    public int getActiveConnectionCount() {
        return STATELESS_MODE;
    }

    @Override
    public List<SessionInfo> getSessions() {
        return List.of();
    }

    @Override
    public boolean isAcceptingConnections() {
        return !shuttingDown.get();
    }
}
