package com.phillippitts.livescribe.presentation.websocket;

import com.phillippitts.livescribe.domain.Identity;
import com.phillippitts.livescribe.service.gateway.ClientConnection;
import com.phillippitts.livescribe.service.gateway.OutboundEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link ClientConnection} over a Spring {@link WebSocketSession}.
 *
 * <p>Sends go through a {@link ConcurrentWebSocketSessionDecorator}, so pump threads and
 * connection threads may publish concurrently. A client that stops reading is disconnected by
 * the decorator once the send time or buffer limit is exceeded.
 */
final class WebSocketClientConnection implements ClientConnection {

    private static final Logger LOG = LogManager.getLogger(WebSocketClientConnection.class);

    private final WebSocketSession session;
    private final Identity identity;
    private final AtomicReference<String> room = new AtomicReference<>();

    WebSocketClientConnection(WebSocketSession session, Identity identity, int sendTimeLimitMs, int sendBufferLimit) {
        Objects.requireNonNull(session, "session");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferLimit,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public Identity identity() {
        return identity;
    }

    @Override
    public void send(OutboundEvent event) {
        if (!session.isOpen()) {
            LOG.debug("Dropping {} for closed connection {}", event.name(), id());
            return;
        }
        try {
            session.sendMessage(new TextMessage(event.toJson()));
        } catch (SessionLimitExceededException e) {
            LOG.warn("Slow client; connection {} terminated: {}", id(), e.getMessage());
        } catch (IOException | IllegalStateException e) {
            LOG.warn("Failed to send {} to connection {}: {}", event.name(), id(), e.toString());
        }
    }

    @Override
    public Optional<String> room() {
        return Optional.ofNullable(room.get());
    }

    @Override
    public void bindRoom(String room) {
        this.room.set(room);
    }

    @Override
    public void unbindRoom(String room) {
        this.room.compareAndSet(room, null);
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public String toString() {
        return "WebSocketClientConnection{id=" + id() + ", user=" + identity.userId() + '}';
    }
}
