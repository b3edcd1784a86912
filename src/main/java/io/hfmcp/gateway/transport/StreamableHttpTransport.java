package io.hfmcp.gateway.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.GatewayContext;
import io.hfmcp.gateway.config.GatewayProperties;
import io.hfmcp.gateway.model.SessionMetadata;
import io.hfmcp.gateway.model.TransportType;
import io.hfmcp.gateway.protocol.JsonRpcErrors;
import io.hfmcp.gateway.protocol.JsonRpcMessage;
import io.hfmcp.gateway.protocol.McpHeaders;
import io.hfmcp.gateway.protocol.McpProtocolException;
import io.hfmcp.gateway.protocol.McpServerInstance;
import io.hfmcp.gateway.registry.ManagedSession;
import io.hfmcp.gateway.server.AugmentationPolicy;
import io.hfmcp.gateway.server.ServerFactory;
import io.hfmcp.gateway.server.ServerRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Session-oriented MCP over HTTP on a single endpoint.
 *
 * <p>A session-less POST carrying {@code initialize} creates a session whose id is returned in
 * the {@code mcp-session-id} header. Later POSTs carry that header and are answered with JSON.
 * A GET opens the session's event stream, which carries server notifications. DELETE ends the
 * session.</p>
 */
public class StreamableHttpTransport extends AbstractStatefulTransport<StreamableHttpTransport.Session> {

    private static final Logger log = LoggerFactory.getLogger(StreamableHttpTransport.class);

    public StreamableHttpTransport(ServerFactory serverFactory,
                                   GatewayContext context,
                                   ObjectMapper objectMapper,
                                   TaskScheduler scheduler,
                                   GatewayProperties.SessionConfig sessionConfig) {
        super(serverFactory, context, objectMapper, scheduler, sessionConfig);
    }

    @Override
    public TransportType type() {
        return TransportType.STREAMABLE_HTTP;
    }

    /**
     * Handle a POSTed JSON-RPC message.
     *
     * @param headers normalised request headers
     * @param body raw request body
     * @return the JSON-RPC response, 202 for notifications, or an error envelope
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

        String sessionId = headers.get(McpHeaders.SESSION_ID);
        try {
            if (sessionId == null) {
                if (!isAcceptingConnections()) {
                    metrics.trackError(503, "ShuttingDown", "Rejected new session during shutdown");
                    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(JsonRpcErrors.serverShuttingDown(message.id()));
                }
                if (!message.isRequest() || !"initialize".equals(message.method())) {
                    metrics.trackError(400, "InvalidRequest", "No valid session ID provided");
                    return ResponseEntity.badRequest()
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(JsonRpcErrors.invalidRequest(message.id(), "Bad Request: No valid session ID provided"));
                }
                return respond(createSession(headers), message, true);
            }

            Optional<Session> session = sessions.get(sessionId);
            if (session.isEmpty()) {
                metrics.trackError(400, "SessionNotFound", "Unknown session " + sessionId);
                return ResponseEntity.badRequest()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(JsonRpcErrors.sessionNotFound(message.id(), sessionId));
            }
            return respond(session.get(), message, false);
        } catch (RuntimeException e) {
            log.error("Error handling {} (session {}): {}", message.method(), sessionId, e.getMessage(), e);
            metrics.trackError(500, e);
            return ResponseEntity.internalServerError()
                .contentType(MediaType.APPLICATION_JSON)
                .body(JsonRpcErrors.internalError(message.id()));
        }
    }

    /**
     * Open the server-to-client event stream of an existing session. A second GET replaces the
     * first stream.
     *
     * @throws TransportHttpException when the session header is missing or unknown
     */
    public SseEmitter handleGet(Map<String, String> headers) {
        metrics.trackRequest();
        Session session = requireSession(headers);
        session.metadata().touch(context.clock().instant());
        if (headers.containsKey(McpHeaders.LAST_EVENT_ID)) {
            log.debug("Ignoring last-event-id for session {}, resumption is not supported", session.metadata().id());
        }

        SseEmitter emitter = new SseEmitter(0L);
        emitter.onCompletion(() -> session.detachStream(emitter));
        emitter.onTimeout(() -> session.detachStream(emitter));
        emitter.onError(e -> session.detachStream(emitter));
        session.attachStream(emitter);
        log.debug("Opened event stream for session {}", session.metadata().id());
        return emitter;
    }

    /**
     * Terminate a session.
     */
    public ResponseEntity<Object> handleDelete(Map<String, String> headers) {
        metrics.trackRequest();
        Session session = requireSession(headers);
        removeSession(session.metadata().id(), "deleted by client");
        return ResponseEntity.ok().build();
    }

    private Session requireSession(Map<String, String> headers) {
        String sessionId = headers.get(McpHeaders.SESSION_ID);
        if (sessionId == null) {
            metrics.trackError(400, "InvalidRequest", "Missing session id");
            throw new TransportHttpException(HttpStatus.BAD_REQUEST,
                JsonRpcErrors.invalidRequest(null, "Bad Request: No valid session ID provided"));
        }
        return sessions.get(sessionId).orElseThrow(() -> {
            metrics.trackError(400, "SessionNotFound", "Unknown session " + sessionId);
            return new TransportHttpException(HttpStatus.BAD_REQUEST, JsonRpcErrors.sessionNotFound(null, sessionId));
        });
    }

    private Session createSession(Map<String, String> headers) {
        SessionMetadata metadata = newSessionMetadata();
        McpServerInstance server = serverFactory.create(
            ServerRequest.of(headers, AugmentationPolicy.ALWAYS, clientInfoCapture(metadata)));
        Session session = new Session(metadata, server);
        registerSession(session);
        return session;
    }

    private ResponseEntity<Object> respond(Session session, JsonRpcMessage message, boolean created) {
        Optional<Map<String, Object>> response = dispatch(session, session.server(), message, session::sendNotification);
        ResponseEntity.BodyBuilder builder = response.isPresent() ? ResponseEntity.ok() : ResponseEntity.accepted();
        if (created) {
            builder.header(McpHeaders.SESSION_ID, session.metadata().id());
        }
        if (response.isEmpty()) {
            return builder.build();
        }
        return builder.contentType(MediaType.APPLICATION_JSON).body(response.get());
    }

    /**
     * One streamable HTTP session: its server and the currently open event stream, if any.
     */
    public static final class Session implements ManagedSession {

        private final SessionMetadata metadata;
        private final McpServerInstance server;
        private final Object streamLock = new Object();
        private volatile SseEmitter stream;

        Session(SessionMetadata metadata, McpServerInstance server) {
            this.metadata = metadata;
            this.server = server;
        }

        @Override
        public SessionMetadata metadata() {
            return metadata;
        }

        McpServerInstance server() {
            return server;
        }

        boolean hasStream() {
            return stream != null;
        }

        void attachStream(SseEmitter emitter) {
            SseEmitter previous;
            synchronized (streamLock) {
                previous = stream;
                stream = emitter;
            }
            if (previous != null) {
                previous.complete();
            }
        }

        void detachStream(SseEmitter emitter) {
            synchronized (streamLock) {
                if (stream == emitter) {
                    stream = null;
                }
            }
        }

        void sendNotification(Map<String, Object> notification) {
            SseEmitter emitter = stream;
            if (emitter == null) {
                log.debug("Dropping notification for session {} without an open stream", metadata.id());
                return;
            }
            try {
                emitter.send(SseEmitter.event().name("message").data(notification, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                log.debug("Event stream of session {} is gone: {}", metadata.id(), e.getMessage());
                detachStream(emitter);
            }
        }

        @Override
        public void close() {
            server.close();
            SseEmitter emitter;
            synchronized (streamLock) {
                emitter = stream;
                stream = null;
            }
            if (emitter != null) {
                emitter.complete();
            }
        }
    }
}
