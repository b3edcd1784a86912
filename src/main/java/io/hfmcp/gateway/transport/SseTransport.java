package io.hfmcp.gateway.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.GatewayContext;
import io.hfmcp.gateway.config.GatewayProperties;
import io.hfmcp.gateway.model.SessionMetadata;
import io.hfmcp.gateway.model.TransportType;
import io.hfmcp.gateway.protocol.JsonRpcErrors;
import io.hfmcp.gateway.protocol.JsonRpcMessage;
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
 * Legacy HTTP+SSE transport.
 *
 * <p>A GET on the stream endpoint opens a long-lived event stream whose first event names the
 * message endpoint for the session. Clients POST messages there and receive the responses
 * as {@code message} events on the stream. Heartbeat comments keep idle streams open.</p>
 */
public class SseTransport extends AbstractStatefulTransport<SseTransport.Session> {

    private static final Logger log = LoggerFactory.getLogger(SseTransport.class);

    public static final String MESSAGE_ENDPOINT = "/message";

    public SseTransport(ServerFactory serverFactory,
                        GatewayContext context,
                        ObjectMapper objectMapper,
                        TaskScheduler scheduler,
                        GatewayProperties.SessionConfig sessionConfig) {
        super(serverFactory, context, objectMapper, scheduler, sessionConfig);
    }

    @Override
    public TransportType type() {
        return TransportType.SSE;
    }

    @Override
    protected void onInitialize() {
        schedule(this::sendHeartbeats, sessionConfig.getHeartbeatInterval());
    }

    /**
     * Open a new session stream. A reconnect naming a known session first closes that session.
     *
     * @param headers normalised request headers
     * @param previousSessionId session id the client reconnects with, may be null
     * @return the event stream, already carrying the {@code endpoint} event
     * @throws TransportHttpException while shutting down or when the stream cannot be started
     */
    public SseEmitter connect(Map<String, String> headers, String previousSessionId) {
        metrics.trackRequest();
        if (!isAcceptingConnections()) {
            metrics.trackError(503, "ShuttingDown", "Rejected new stream during shutdown");
            throw new TransportHttpException(HttpStatus.SERVICE_UNAVAILABLE, JsonRpcErrors.serverShuttingDown(null));
        }
        if (previousSessionId != null && removeSession(previousSessionId, "client reconnected")) {
            log.info("Client reconnected, replaced session {}", previousSessionId);
        }

        SessionMetadata metadata = newSessionMetadata();
        McpServerInstance server = serverFactory.create(
            ServerRequest.of(headers, AugmentationPolicy.ALWAYS, clientInfoCapture(metadata)));
        SseEmitter emitter = new SseEmitter(0L);
        Session session = new Session(metadata, server, emitter);
        registerSession(session);

        String sessionId = metadata.id();
        emitter.onCompletion(() -> removeSession(sessionId, "stream closed"));
        emitter.onTimeout(() -> removeSession(sessionId, "stream timed out"));
        emitter.onError(e -> removeSession(sessionId, "stream error"));
        try {
            emitter.send(SseEmitter.event().name("endpoint").data(MESSAGE_ENDPOINT + "?sessionId=" + sessionId));
        } catch (IOException e) {
            removeSession(sessionId, "endpoint event failed");
            metrics.trackError(500, e);
            throw new TransportHttpException(HttpStatus.INTERNAL_SERVER_ERROR, JsonRpcErrors.internalError(null));
        }
        return emitter;
    }

    /**
     * Handle a message POSTed for a session. The JSON-RPC response travels on the stream.
     *
     * @return 202 once the message was handled, or an error envelope
     */
    public ResponseEntity<Object> handleMessage(String sessionId, Map<String, String> headers, String body) {
        metrics.trackRequest();
        Optional<Session> found = sessions.get(sessionId);
        if (found.isEmpty()) {
            metrics.trackError(400, "SessionNotFound", "Unknown session " + sessionId);
            return ResponseEntity.badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(JsonRpcErrors.sessionNotFound(null, String.valueOf(sessionId)));
        }
        Session session = found.get();

        JsonRpcMessage message;
        try {
            message = JsonRpcMessage.parse(objectMapper, body);
        } catch (McpProtocolException e) {
            metrics.trackError(400, "ParseError", e.getMessage());
            return ResponseEntity.badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(JsonRpcErrors.error(null, e.getCode(), e.getMessage()));
        }

        try {
            Optional<Map<String, Object>> response = dispatch(session, session.server(), message, session::sendQuietly);
            if (response.isPresent()) {
                session.send(response.get());
            }
            return ResponseEntity.accepted().build();
        } catch (IOException | IllegalStateException e) {
            log.warn("Could not deliver response to session {}: {}", sessionId, e.getMessage());
            metrics.trackError(500, e);
            removeSession(sessionId, "stream write failed");
            return ResponseEntity.internalServerError()
                .contentType(MediaType.APPLICATION_JSON)
                .body(JsonRpcErrors.internalError(message.id()));
        } catch (RuntimeException e) {
            log.error("Error handling {} for session {}: {}", message.method(), sessionId, e.getMessage(), e);
            metrics.trackError(500, e);
            return ResponseEntity.internalServerError()
                .contentType(MediaType.APPLICATION_JSON)
                .body(JsonRpcErrors.internalError(message.id()));
        }
    }

    /**
     * Send a heartbeat comment on every open stream. Streams that fail are closed.
     *
     * @return the number of failed heartbeats
     */
    int sendHeartbeats() {
        int failed = 0;
        for (String sessionId : sessions.ids()) {
            Optional<Session> session = sessions.get(sessionId);
            if (session.isEmpty()) {
                continue;
            }
            metrics.trackPingSent();
            try {
                session.get().emitter().send(SseEmitter.event().comment("ping"));
                session.get().metadata().touch(context.clock().instant());
                metrics.trackPingSuccess();
            } catch (IOException | IllegalStateException e) {
                metrics.trackPingFailed();
                failed++;
                log.warn("Heartbeat failed for session {}: {}", sessionId, e.getMessage());
                removeSession(sessionId, "heartbeat failed");
            }
        }
        return failed;
    }

    /**
     * One SSE session: its server and its event stream.
     */
    public static final class Session implements ManagedSession {

        private final SessionMetadata metadata;
        private final McpServerInstance server;
        private final SseEmitter emitter;

        Session(SessionMetadata metadata, McpServerInstance server, SseEmitter emitter) {
            this.metadata = metadata;
            this.server = server;
            this.emitter = emitter;
        }

        @Override
        public SessionMetadata metadata() {
            return metadata;
        }

        McpServerInstance server() {
            return server;
        }

        SseEmitter emitter() {
            return emitter;
        }

        void send(Map<String, Object> message) throws IOException {
            emitter.send(SseEmitter.event().name("message").data(message, MediaType.APPLICATION_JSON));
        }

        void sendQuietly(Map<String, Object> notification) {
            try {
                send(notification);
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping notification for session {}: {}", metadata.id(), e.getMessage());
            }
        }

        @Override
        public void close() {
            server.close();
            emitter.complete();
        }
    }
}
