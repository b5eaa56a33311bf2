package com.phillippitts.livescribe.presentation.websocket;

import com.phillippitts.livescribe.domain.Identity;
import com.phillippitts.livescribe.service.gateway.OutboundEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketClientConnectionTest {

    private WebSocketSession session;
    private WebSocketClientConnection connection;

    @BeforeEach
    void setUp() {
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);
        connection = new WebSocketClientConnection(session, Identity.of("u1"), 5000, 524288);
    }

    @Test
    void sendsEventAsJsonText() throws IOException {
        connection.send(OutboundEvent.started("m1"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<WebSocketMessage<?>> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(session).sendMessage(captor.capture());
        assertThat(captor.getValue()).isInstanceOf(TextMessage.class);
        assertThat(((TextMessage) captor.getValue()).getPayload())
                .contains("\"event\":\"stream:started\"")
                .contains("\"sessionId\":\"m1\"");
    }

    @Test
    void sendFailureIsContained() throws IOException {
        doThrow(new IOException("reset")).when(session).sendMessage(any());

        assertDoesNotThrow(() -> connection.send(OutboundEvent.started("m1")));
    }

    @Test
    void dropsEventsForClosedSession() throws IOException {
        when(session.isOpen()).thenReturn(false);

        connection.send(OutboundEvent.started("m1"));

        verify(session, never()).sendMessage(any());
        assertThat(connection.isOpen()).isFalse();
    }

    @Test
    void roomBindingOnlyClearsMatchingRoom() {
        connection.bindRoom("m1");

        connection.unbindRoom("m2");
        assertThat(connection.room()).contains("m1");

        connection.unbindRoom("m1");
        assertThat(connection.room()).isEmpty();
    }
}
