package com.phillippitts.livescribe.presentation.websocket;

import com.phillippitts.livescribe.config.properties.GatewayProperties;
import com.phillippitts.livescribe.domain.Identity;
import com.phillippitts.livescribe.service.gateway.ClientConnection;
import com.phillippitts.livescribe.service.gateway.ConnectionGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TranscriptionWebSocketHandlerTest {

    private ConnectionGateway gateway;
    private TranscriptionWebSocketHandler handler;
    private WebSocketSession session;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        gateway = mock(ConnectionGateway.class);
        GatewayProperties properties = new GatewayProperties("/ws/transcription", List.of("*"),
                1048576, 262144, Duration.ofMinutes(5), Duration.ofSeconds(5), 524288);
        handler = new TranscriptionWebSocketHandler(gateway, properties);
        session = mock(WebSocketSession.class);
        attributes = new HashMap<>();
        when(session.getId()).thenReturn("s1");
        when(session.getAttributes()).thenReturn(attributes);
        when(session.isOpen()).thenReturn(true);
    }

    @Test
    void closesConnectionWithoutVerifiedIdentity() throws IOException {
        handler.afterConnectionEstablished(session);

        verify(session).close(CloseStatus.POLICY_VIOLATION);
        verify(gateway, never()).onConnect(any());
        assertThat(handler.connectionCount()).isZero();
    }

    @Test
    void registersAuthenticatedConnection() throws IOException {
        attributes.put(TokenHandshakeInterceptor.IDENTITY_ATTRIBUTE, Identity.of("u1"));

        handler.afterConnectionEstablished(session);

        ArgumentCaptor<ClientConnection> captor = ArgumentCaptor.forClass(ClientConnection.class);
        verify(gateway).onConnect(captor.capture());
        assertThat(captor.getValue().id()).isEqualTo("s1");
        assertThat(captor.getValue().identity()).isEqualTo(Identity.of("u1"));
        assertThat(handler.connectionCount()).isEqualTo(1);
    }

    @Test
    void routesTextAndBinaryFramesToGateway() throws Exception {
        attributes.put(TokenHandshakeInterceptor.IDENTITY_ATTRIBUTE, Identity.of("u1"));
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new TextMessage("{\"event\":\"stream:leave\"}"));
        handler.handleMessage(session, new BinaryMessage(new byte[]{4, 5, 6}));

        verify(gateway).onText(any(ClientConnection.class), eq("{\"event\":\"stream:leave\"}"));
        verify(gateway).onBinary(any(ClientConnection.class), eq(new byte[]{4, 5, 6}));
    }

    @Test
    void closeNotifiesGatewayOnce() throws IOException {
        attributes.put(TokenHandshakeInterceptor.IDENTITY_ATTRIBUTE, Identity.of("u1"));
        handler.afterConnectionEstablished(session);

        handler.afterConnectionClosed(session, CloseStatus.GOING_AWAY);
        handler.afterConnectionClosed(session, CloseStatus.GOING_AWAY);

        verify(gateway).onDisconnect(any(ClientConnection.class));
        assertThat(handler.connectionCount()).isZero();
    }

    @Test
    void transportErrorIsForwarded() throws IOException {
        attributes.put(TokenHandshakeInterceptor.IDENTITY_ATTRIBUTE, Identity.of("u1"));
        handler.afterConnectionEstablished(session);
        IOException error = new IOException("broken pipe");

        handler.handleTransportError(session, error);

        verify(gateway).onTransportError(any(ClientConnection.class), eq(error));
    }
}
