package io.hfmcp.gateway.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.GatewayContext;
import io.hfmcp.gateway.config.GatewayProperties;
import io.hfmcp.gateway.metrics.TransportMetrics;
import io.hfmcp.gateway.model.SessionInfo;
import io.hfmcp.gateway.model.SessionMetadata;
import io.hfmcp.gateway.protocol.ClientInfoListener;
import io.hfmcp.gateway.protocol.JsonRpcMessage;
import io.hfmcp.gateway.protocol.McpServerInstance;
import io.hfmcp.gateway.protocol.NotificationSink;
import io.hfmcp.gateway.registry.ManagedSession;
import io.hfmcp.gateway.registry.SessionRegistry;
import io.hfmcp.gateway.server.ServerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base class for transports that keep one server instance per client session.
 *
 * <p>Owns the session registry, the periodic stale-session sweep and the shutdown flag.
 * Requests within one session are dispatched one at a time.</p>
 *
 * @param <S> the transport's session type
 */
public abstract class AbstractStatefulTransport<S extends ManagedSession> implements McpTransport {

    private static final Logger log = LoggerFactory.getLogger(AbstractStatefulTransport.class);

    protected final SessionRegistry<S> sessions = new SessionRegistry<>();
    protected final ServerFactory serverFactory;
    protected final GatewayContext context;
    protected final TransportMetrics metrics;
    protected final ObjectMapper objectMapper;
    protected final GatewayProperties.SessionConfig sessionConfig;

    private final TaskScheduler scheduler;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final List<ScheduledFuture<?>> scheduledTasks = new CopyOnWriteArrayList<>();
    private volatile TransportOptions options = TransportOptions.defaults();

    protected AbstractStatefulTransport(ServerFactory serverFactory,
                                        GatewayContext context,
                                        ObjectMapper objectMapper,
                                        TaskScheduler scheduler,
                                        GatewayProperties.SessionConfig sessionConfig) {
        this.serverFactory = serverFactory;
        this.context = context;
        this.metrics = context.transportMetrics();
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.sessionConfig = sessionConfig;
    }

    @Override
    public void initialize(TransportOptions options) {
        this.options = options != null ? options : TransportOptions.defaults();
        schedule(this::sweepStaleSessions, sessionConfig.getCheckInterval());
        onInitialize();
        log.info("Initialized {} transport (stale timeout {}, check interval {})",
            type().value(), sessionConfig.getStaleTimeout(), sessionConfig.getCheckInterval());
    }

    /**
     * Hook for transport-specific background work.
     */
    protected void onInitialize() {
    }

    protected void schedule(Runnable task, Duration period) {
        Instant firstRun = Instant.now().plus(period);
        scheduledTasks.add(scheduler.scheduleAtFixedRate(task, firstRun, period));
    }

    /**
     * Remove every session idle for longer than the stale timeout. Skipped while shutting down.
     *
     * @return the number of sessions removed
     */
    public int sweepStaleSessions() {
        if (shuttingDown.get()) {
            log.debug("Skipping stale session sweep during shutdown");
            return 0;
        }
        Instant now = context.clock().instant();
        int removed = 0;
        for (String sessionId : sessions.staleIds(now, sessionConfig.getStaleTimeout())) {
            if (removeSession(sessionId, "stale")) {
                metrics.trackSessionCleaned();
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} stale sessions, {} remaining", removed, sessions.size());
        }
        return removed;
    }

    /**
     * Unregister and close a session.
     *
     * @return true if the session was registered
     */
    protected boolean removeSession(String sessionId, String reason) {
        S session = sessions.unregister(sessionId);
        if (session == null) {
            return false;
        }
        closeSession(session);
        metrics.updateActiveConnections(sessions.size());
        log.info("Closed session {} ({})", sessionId, reason);
        return true;
    }

    private boolean closeSession(S session) {
        session.metadata().updateStatus(SessionMetadata.Status.CLOSED);
        metrics.clientDisconnected(session.metadata().clientInfo());
        try {
            session.close();
            return true;
        } catch (Exception e) {
            log.warn("Error closing session {}: {}", session.metadata().id(), e.getMessage());
            return false;
        }
    }

    protected void registerSession(S session) {
        sessions.register(session);
        metrics.trackNewConnection();
        metrics.updateActiveConnections(sessions.size());
        log.info("Created {} session {}", type().value(), session.metadata().id());
    }

    protected SessionMetadata newSessionMetadata() {
        return new SessionMetadata(UUID.randomUUID().toString(), type(), context.clock().instant());
    }

    /**
     * Listener that records the client identity on the session and forwards it to the host.
     */
    protected ClientInfoListener clientInfoCapture(SessionMetadata metadata) {
        return (clientInfo, sampling, roots) -> {
            metadata.updateClient(clientInfo, sampling, roots);
            metrics.clientConnected(clientInfo);
            options.clientInfoListener().onInitialized(clientInfo, sampling, roots);
        };
    }

    /**
     * Handle one message on a session, serialised per session, recording method timings.
     */
    protected Optional<Map<String, Object>> dispatch(S session, McpServerInstance server,
                                                     JsonRpcMessage message, NotificationSink notifications) {
        session.metadata().touch(context.clock().instant());
        long started = System.nanoTime();
        boolean error = false;
        synchronized (session) {
            try {
                Optional<Map<String, Object>> response = server.handle(message, notifications);
                error = response.map(r -> r.containsKey("error")).orElse(false);
                return response;
            } catch (RuntimeException e) {
                error = true;
                throw e;
            } finally {
                if (message.method() != null) {
                    metrics.trackMethod(message.trackingKey(), Duration.ofNanos(System.nanoTime() - started), error);
                }
                metrics.clientActivity(session.metadata().clientInfo());
            }
        }
    }

    @Override
    public void shutdown() {
        if (shuttingDown.compareAndSet(false, true)) {
            log.info("{} transport no longer accepting connections", type().value());
        }
    }

    @Override
    public void cleanup() {
        shutdown();
        scheduledTasks.forEach(task -> task.cancel(false));
        scheduledTasks.clear();

        int closed = 0;
        int failed = 0;
        for (String sessionId : sessions.ids()) {
            S session = sessions.unregister(sessionId);
            if (session == null) {
                continue;
            }
            if (closeSession(session)) {
                closed++;
            } else {
                failed++;
            }
        }
        metrics.updateActiveConnections(sessions.size());
        if (closed + failed > 0) {
            log.info("Closed {} sessions during cleanup ({} failed)", closed, failed);
        }
    }

    @Override
    public int getActiveConnectionCount() {
        return sessions.size();
    }

    @Override
    public List<SessionInfo> getSessions() {
        return sessions.snapshots();
    }

    @Override
    public boolean isAcceptingConnections() {
        return !shuttingDown.get();
    }
}
