package com.phillippitts.livescribe.service.gateway;

import com.phillippitts.livescribe.config.logging.LogContext;
import com.phillippitts.livescribe.domain.Identity;
import com.phillippitts.livescribe.exception.InvalidTokenException;
import com.phillippitts.livescribe.exception.ProtocolMisuseException;
import com.phillippitts.livescribe.exception.SessionNotFoundException;
import com.phillippitts.livescribe.service.collaborator.IdentityVerifier;
import com.phillippitts.livescribe.service.collaborator.SessionOwnershipLookup;
import com.phillippitts.livescribe.service.coordinator.SessionCoordinator;
import com.phillippitts.livescribe.util.LogSanitizer;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Transport-independent entry point for client connections.
 *
 * <p>Authenticates connections, decodes inbound events, checks authorization against the
 * ownership lookup and hands the rest to the {@link SessionCoordinator}. Client mistakes are
 * answered with {@code stream:error} on the same connection; the connection stays open.
 *
 * <p>Authorization rules:
 * <ul>
 *   <li>{@code stream:start}: caller must own the session id</li>
 *   <li>{@code stream:audio}, {@code stream:stop}: checked by the coordinator against the live
 *       session owner</li>
 *   <li>{@code stream:join}: caller must be allowed to observe the session</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
public class ConnectionGateway {

    private static final Logger LOG = LogManager.getLogger(ConnectionGateway.class);
    private static final int MAX_LOGGED_NAME = 64;

    private final IdentityVerifier identityVerifier;
    private final SessionOwnershipLookup ownershipLookup;
    private final SessionCoordinator coordinator;
    private final RoomBroadcaster connections;

    public ConnectionGateway(IdentityVerifier identityVerifier,
                             SessionOwnershipLookup ownershipLookup,
                             SessionCoordinator coordinator,
                             RoomBroadcaster connections) {
        this.identityVerifier = Objects.requireNonNull(identityVerifier, "identityVerifier");
        this.ownershipLookup = Objects.requireNonNull(ownershipLookup, "ownershipLookup");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    /**
     * Verifies the handshake token.
     *
     * @throws InvalidTokenException if the token is missing or invalid
     */
    public Identity authenticate(String token) {
        return identityVerifier.verify(token);
    }

    public void onConnect(ClientConnection connection) {
        connections.register(connection);
        try (CloseableThreadContext.Instance ignored = context(connection)) {
            LOG.info("Client connected");
        }
    }

    /**
     * Handles one JSON text frame.
     */
    public void onText(ClientConnection connection, String payload) {
        try (CloseableThreadContext.Instance ctx = context(connection)) {
            InboundEvent event;
            try {
                event = InboundEventParser.parse(payload);
            } catch (ProtocolMisuseException e) {
                LOG.warn("Malformed event: {}", e.getMessage());
                connection.send(OutboundEvent.error(StreamErrorReason.MALFORMED_EVENT, null));
                return;
            }
            if (event.sessionId() != null) {
                ctx.put(LogContext.SESSION_ID, event.sessionId());
            }
            dispatch(connection, event);
        }
    }

    /**
     * Handles a raw audio frame for the session the connection is bound to.
     */
    public void onBinary(ClientConnection connection, byte[] chunk) {
        Optional<String> room = connection.room();
        if (room.isEmpty()) {
            connection.send(OutboundEvent.error(StreamErrorReason.NOT_ACTIVE, null));
            return;
        }
        try (CloseableThreadContext.Instance ctx = context(connection)) {
            ctx.put(LogContext.SESSION_ID, room.get());
            coordinator.audio(connection, room.get(), chunk);
        }
    }

    public void onDisconnect(ClientConnection connection) {
        try (CloseableThreadContext.Instance ignored = context(connection)) {
            LOG.info("Client disconnected");
            coordinator.connectionClosed(connection);
        } finally {
            connections.unregister(connection);
        }
    }

    /**
     * Logs a transport error. The transport closes the connection afterwards, which arrives
     * here as {@link #onDisconnect}.
     */
    public void onTransportError(ClientConnection connection, Throwable error) {
        try (CloseableThreadContext.Instance ignored = context(connection)) {
            LOG.warn("Transport error: {}", error.toString());
        }
    }

    private void dispatch(ClientConnection connection, InboundEvent event) {
        switch (event.type()) {
            case START -> handleStart(connection, event);
            case AUDIO -> coordinator.audio(connection, event.sessionId(), event.audio());
            case STOP -> coordinator.stop(connection, event.sessionId());
            case JOIN -> handleJoin(connection, event.sessionId());
            case LEAVE -> coordinator.leave(connection);
            case UNKNOWN -> {
                LOG.warn("Unknown event: {}", LogSanitizer.truncate(event.name(), MAX_LOGGED_NAME));
                connection.send(OutboundEvent.error(StreamErrorReason.UNKNOWN_EVENT, null));
            }
        }
    }

    private void handleStart(ClientConnection connection, InboundEvent event) {
        String sessionId = event.sessionId();
        Identity owner;
        try {
            owner = ownershipLookup.ownerOf(sessionId);
        } catch (SessionNotFoundException e) {
            LOG.info("Start for unknown session");
            connection.send(OutboundEvent.error(StreamErrorReason.SESSION_NOT_FOUND, sessionId));
            return;
        } catch (RuntimeException e) {
            LOG.error("Ownership lookup failed", e);
            connection.send(OutboundEvent.error(StreamErrorReason.START_FAILED, sessionId));
            return;
        }
        if (!owner.equals(connection.identity())) {
            LOG.warn("Start rejected: caller is not the owner");
            connection.send(OutboundEvent.error(StreamErrorReason.UNAUTHORIZED, sessionId));
            return;
        }
        coordinator.start(connection, sessionId, event.options());
    }

    private void handleJoin(ClientConnection connection, String sessionId) {
        boolean allowed;
        try {
            allowed = ownershipLookup.canObserve(sessionId, connection.identity());
        } catch (SessionNotFoundException e) {
            connection.send(OutboundEvent.error(StreamErrorReason.SESSION_NOT_FOUND, sessionId));
            return;
        } catch (RuntimeException e) {
            LOG.error("Ownership lookup failed", e);
            connection.send(OutboundEvent.error(StreamErrorReason.NOT_ACTIVE, sessionId));
            return;
        }
        if (!allowed) {
            LOG.warn("Join rejected: caller may not observe session");
            connection.send(OutboundEvent.error(StreamErrorReason.UNAUTHORIZED, sessionId));
            return;
        }
        coordinator.join(connection, sessionId);
    }

    private static CloseableThreadContext.Instance context(ClientConnection connection) {
        return LogContext.forConnection(connection.id(), connection.identity().userId());
    }
}
