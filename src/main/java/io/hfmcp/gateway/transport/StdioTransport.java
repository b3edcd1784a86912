package io.hfmcp.gateway.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.GatewayContext;
import io.hfmcp.gateway.metrics.TransportMetrics;
import io.hfmcp.gateway.model.SessionInfo;
import io.hfmcp.gateway.model.SessionMetadata;
import io.hfmcp.gateway.model.TransportType;
import io.hfmcp.gateway.protocol.JsonRpcErrors;
import io.hfmcp.gateway.protocol.JsonRpcMessage;
import io.hfmcp.gateway.protocol.McpProtocolException;
import io.hfmcp.gateway.protocol.McpServerInstance;
import io.hfmcp.gateway.server.AugmentationPolicy;
import io.hfmcp.gateway.server.ServerFactory;
import io.hfmcp.gateway.server.ServerRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-session transport over line-delimited JSON on standard input and output.
 *
 * <p>Standard output carries protocol messages only; logging goes to standard error. End of
 * input ends the session and invokes {@link TransportOptions#onClose()}.</p>
 */
public class StdioTransport implements McpTransport {

    private static final Logger log = LoggerFactory.getLogger(StdioTransport.class);

    static final String SESSION_ID = "stdio";

    private final ServerFactory serverFactory;
    private final GatewayContext context;
    private final TransportMetrics metrics;
    private final ObjectMapper objectMapper;
    private final InputStream input;
    private final OutputStream output;
    private final Object writeLock = new Object();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile SessionMetadata session;
    private volatile McpServerInstance server;
    private Thread reader;

    public StdioTransport(ServerFactory serverFactory,
                          GatewayContext context,
                          ObjectMapper objectMapper,
                          InputStream input,
                          OutputStream output) {
        this.serverFactory = serverFactory;
        this.context = context;
        this.metrics = context.transportMetrics();
        this.objectMapper = objectMapper;
        this.input = input;
        this.output = output;
    }

    @Override
    public TransportType type() {
        return TransportType.STDIO;
    }

    @Override
    public void initialize(TransportOptions options) {
        TransportOptions effective = options != null ? options : TransportOptions.defaults();
        open(effective);
        reader = new Thread(() -> readLoop(effective), "mcp-stdio-reader");
        reader.start();
        log.info("stdio transport ready");
    }

    /**
     * Create the session and its server without starting the reader thread.
     */
    void open(TransportOptions options) {
        SessionMetadata metadata = new SessionMetadata(SESSION_ID, TransportType.STDIO, context.clock().instant());
        this.server = serverFactory.create(ServerRequest.of(Map.of(), AugmentationPolicy.ALWAYS,
            (clientInfo, sampling, roots) -> {
                metadata.updateClient(clientInfo, sampling, roots);
                metrics.clientConnected(clientInfo);
                options.clientInfoListener().onInitialized(clientInfo, sampling, roots);
            }));
        this.session = metadata;
        metrics.trackNewConnection();
        metrics.updateActiveConnections(1);
    }

    void readLoop(TransportOptions options) {
        try (BufferedReader lines = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while (!closed.get() && (line = lines.readLine()) != null) {
                if (!line.isBlank()) {
                    handleLine(line);
                }
            }
        } catch (IOException | UncheckedIOException e) {
            if (!closed.get()) {
                log.error("stdio stream failed: {}", e.getMessage(), e);
            }
        }
        if (!closed.get()) {
            log.info("Standard input closed, shutting down");
            cleanup();
            options.onClose().run();
        }
    }

    /**
     * Handle one input line and write any response to the output.
     *
     * @return the response written, if any
     */
    Optional<Map<String, Object>> handleLine(String line) {
        metrics.trackRequest();
        JsonRpcMessage message;
        try {
            message = JsonRpcMessage.parse(objectMapper, line);
        } catch (McpProtocolException e) {
            metrics.trackError(400, "ParseError", e.getMessage());
            Map<String, Object> error = JsonRpcErrors.error(null, e.getCode(), e.getMessage());
            write(error);
            return Optional.of(error);
        }

        McpServerInstance current = server;
        if (current == null || closed.get()) {
            log.warn("Ignoring {} received after the session closed", message.method());
            return Optional.empty();
        }
        session.touch(context.clock().instant());
        long started = System.nanoTime();
        boolean error = false;
        Optional<Map<String, Object>> response;
        try {
            response = current.handle(message, this::write);
            error = response.map(r -> r.containsKey("error")).orElse(false);
        } catch (RuntimeException e) {
            error = true;
            log.error("Error handling {}: {}", message.method(), e.getMessage(), e);
            metrics.trackError(500, e);
            response = message.isRequest() ? Optional.of(JsonRpcErrors.internalError(message.id())) : Optional.empty();
        } finally {
            if (message.method() != null) {
                metrics.trackMethod(message.trackingKey(), Duration.ofNanos(System.nanoTime() - started), error);
            }
            metrics.clientActivity(session.clientInfo());
        }
        response.ifPresent(this::write);
        return response;
    }

    private void write(Map<String, Object> message) {
        synchronized (writeLock) {
            try {
                output.write(objectMapper.writeValueAsBytes(message));
                output.write('\n');
                output.flush();
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Could not serialise outbound message", e);
            } catch (IOException e) {
                throw new UncheckedIOException("Could not write to standard output", e);
            }
        }
    }

    @Override
    public void shutdown() {
        shuttingDown.set(true);
    }

    @Override
    public void cleanup() {
        shutdown();
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        McpServerInstance current = server;
        if (current != null) {
            current.close();
        }
        if (session != null) {
            session.updateStatus(SessionMetadata.Status.CLOSED);
            metrics.clientDisconnected(session.clientInfo());
        }
        metrics.updateActiveConnections(0);
        log.info("stdio session closed");
    }

    @Override
    public int getActiveConnectionCount() {
        return session != null && !closed.get() ? 1 : 0;
    }

    @Override
    public List<SessionInfo> getSessions() {
        SessionMetadata current = session;
        return current != null && !closed.get() ? List.of(current.snapshot()) : List.of();
    }

    @Override
    public boolean isAcceptingConnections() {
        return !shuttingDown.get();
    }
}
