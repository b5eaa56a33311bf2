package com.phillippitts.livescribe.presentation.websocket;

import com.phillippitts.livescribe.config.properties.GatewayProperties;
import com.phillippitts.livescribe.domain.Identity;
import com.phillippitts.livescribe.service.gateway.ClientConnection;
import com.phillippitts.livescribe.service.gateway.ConnectionGateway;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint for live transcription clients.
 *
 * <p>Adapts Spring WebSocket callbacks to the {@link ConnectionGateway}: JSON text frames carry
 * events, binary frames carry raw audio for the session the connection started or joined.
 */
public class TranscriptionWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(TranscriptionWebSocketHandler.class);

    private final ConnectionGateway gateway;
    private final int sendTimeLimitMs;
    private final int sendBufferLimit;
    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();

    public TranscriptionWebSocketHandler(ConnectionGateway gateway, GatewayProperties properties) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.sendTimeLimitMs = Math.toIntExact(properties.sendTimeLimit().toMillis());
        this.sendBufferLimit = properties.sendBufferLimit();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        Object attr = session.getAttributes().get(TokenHandshakeInterceptor.IDENTITY_ATTRIBUTE);
        if (!(attr instanceof Identity identity)) {
            // Handshake interceptor not applied; never serve an anonymous connection
            LOG.error("Connection {} has no verified identity; closing", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        ClientConnection connection = new WebSocketClientConnection(session, identity, sendTimeLimitMs, sendBufferLimit);
        connections.put(session.getId(), connection);
        gateway.onConnect(connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientConnection connection = connections.get(session.getId());
        if (connection != null) {
            gateway.onText(connection, message.getPayload());
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        ClientConnection connection = connections.get(session.getId());
        if (connection == null) {
            return;
        }
        ByteBuffer payload = message.getPayload();
        byte[] chunk = new byte[payload.remaining()];
        payload.get(chunk);
        gateway.onBinary(connection, chunk);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ClientConnection connection = connections.get(session.getId());
        if (connection != null) {
            gateway.onTransportError(connection, exception);
        } else {
            LOG.warn("Transport error on unregistered connection {}: {}", session.getId(), exception.toString());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientConnection connection = connections.remove(session.getId());
        if (connection != null) {
            LOG.debug("Connection {} closed: {}", session.getId(), status);
            gateway.onDisconnect(connection);
        }
    }

    int connectionCount() {
        return connections.size();
    }
}
