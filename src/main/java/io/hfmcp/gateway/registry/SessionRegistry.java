package io.hfmcp.gateway.registry;

import io.hfmcp.gateway.model.SessionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the live sessions of one transport.
 *
 * <p>Provides thread-safe registration, removal and lookup of sessions by id, and
 * selection of sessions idle for longer than a timeout.</p>
 *
 * @param <S> the transport's session type
 */
public class SessionRegistry<S extends ManagedSession> {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, S> sessions = new ConcurrentHashMap<>();

    /**
     * Register a new session.
     *
     * @param session the session
     * @throws IllegalStateException if a session with the same id is already registered
     */
    public void register(S session) {
        String id = session.metadata().id();
        if (sessions.putIfAbsent(id, session) != null) {
            throw new IllegalStateException("Session already registered: " + id);
        }
        log.debug("Registered session {}", id);
    }

    /**
     * Remove a session.
     *
     * @param sessionId the session id
     * @return the removed session, or null if it was not registered
     */
    public S unregister(String sessionId) {
        S session = sessions.remove(sessionId);
        if (session != null) {
            log.debug("Unregistered session {}", sessionId);
        }
        return session;
    }

    /**
     * Get a session by id.
     *
     * @param sessionId the session id, may be null
     * @return the session, if registered
     */
    public Optional<S> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public List<String> ids() {
        return new ArrayList<>(sessions.keySet());
    }

    public List<SessionInfo> snapshots() {
        return sessions.values().stream()
            .map(session -> session.metadata().snapshot())
            .toList();
    }

    /**
     * Ids of sessions whose last activity is more than {@code timeout} before {@code now}.
     */
    public List<String> staleIds(Instant now, Duration timeout) {
        return sessions.values().stream()
            .filter(session -> session.metadata().idleTime(now).compareTo(timeout) > 0)
            .map(session -> session.metadata().id())
            .toList();
    }

    public int size() {
        return sessions.size();
    }

    public boolean isEmpty() {
        return sessions.isEmpty();
    }
}
