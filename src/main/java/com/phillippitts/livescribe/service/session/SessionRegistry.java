package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.Identity;
import com.phillippitts.livescribe.exception.DuplicateSessionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory table of live sessions keyed by session id.
 *
 * <p>{@link #create} is a single atomic check-and-insert: of any number of concurrent creates
 * for the same id exactly one succeeds. Entries live for the process lifetime only.
 *
 * @since 1.0
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionRegistry() {
        this(Clock.systemUTC());
    }

    SessionRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates and registers a new session in state IDLE.
     *
     * @param sessionId         client-supplied session id
     * @param owner             identity of the starting connection
     * @param ownerConnectionId id of the starting connection
     * @return the registered session
     * @throws DuplicateSessionException if a session with this id is already registered
     */
    public Session create(String sessionId, Identity owner, String ownerConnectionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        Session candidate = new Session(sessionId, owner, ownerConnectionId, clock.instant());
        Session existing = sessions.putIfAbsent(sessionId, candidate);
        if (existing != null) {
            throw new DuplicateSessionException(sessionId);
        }
        LOG.debug("Registered session {} for user {}", sessionId, owner.userId());
        return candidate;
    }

    public Optional<Session> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Removes whatever session is registered under {@code sessionId}. No-op when absent.
     */
    public void remove(String sessionId) {
        if (sessionId != null && sessions.remove(sessionId) != null) {
            LOG.debug("Removed session {}", sessionId);
        }
    }

    /**
     * Removes {@code session} only if it is still the registered entry for {@code sessionId}.
     *
     * @return {@code true} if the entry was removed
     */
    public boolean remove(String sessionId, Session session) {
        boolean removed = sessionId != null && session != null && sessions.remove(sessionId, session);
        if (removed) {
            LOG.debug("Removed session {}", sessionId);
        }
        return removed;
    }

    public List<Session> snapshot() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    public void clear() {
        sessions.clear();
    }
}
