package com.phillippitts.livescribe.service.gateway;

import com.phillippitts.livescribe.domain.Identity;
import com.phillippitts.livescribe.domain.StreamOptions;
import com.phillippitts.livescribe.exception.InvalidTokenException;
import com.phillippitts.livescribe.exception.SessionNotFoundException;
import com.phillippitts.livescribe.service.collaborator.IdentityVerifier;
import com.phillippitts.livescribe.service.collaborator.SessionOwnershipLookup;
import com.phillippitts.livescribe.service.coordinator.SessionCoordinator;
import com.phillippitts.livescribe.testutil.FakeClientConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ConnectionGatewayTest {

    private IdentityVerifier verifier;
    private SessionOwnershipLookup lookup;
    private SessionCoordinator coordinator;
    private RoomBroadcaster broadcaster;
    private ConnectionGateway gateway;
    private FakeClientConnection owner;

    @BeforeEach
    void setUp() {
        verifier = mock(IdentityVerifier.class);
        lookup = mock(SessionOwnershipLookup.class);
        coordinator = mock(SessionCoordinator.class);
        broadcaster = new RoomBroadcaster();
        gateway = new ConnectionGateway(verifier, lookup, coordinator, broadcaster);
        owner = new FakeClientConnection("c1", "u1");
        gateway.onConnect(owner);
    }

    @Test
    void shouldRegisterConnectionOnConnect() {
        assertThat(broadcaster.connection("c1")).contains(owner);
    }

    @Test
    void authenticateDelegatesToVerifier() {
        when(verifier.verify("good")).thenReturn(Identity.of("u1"));
        when(verifier.verify("bad")).thenThrow(new InvalidTokenException("bad signature"));

        assertThat(gateway.authenticate("good")).isEqualTo(Identity.of("u1"));
        assertThatThrownBy(() -> gateway.authenticate("bad")).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void ownerStartIsHandedToCoordinator() {
        // Arrange
        when(lookup.ownerOf("m1")).thenReturn(Identity.of("u1"));

        // Act
        gateway.onText(owner, "{\"event\":\"stream:start\",\"data\":{\"sessionId\":\"m1\",\"language\":\"de\"}}");

        // Assert
        verify(coordinator).start(eq(owner), eq("m1"), eq(new StreamOptions(null, null, null, "de", null)));
        assertThat(owner.received()).isEmpty();
    }

    @Test
    void nonOwnerStartIsRejected() {
        when(lookup.ownerOf("m1")).thenReturn(Identity.of("someone-else"));

        gateway.onText(owner, "{\"event\":\"stream:start\",\"data\":{\"sessionId\":\"m1\"}}");

        verify(coordinator, never()).start(any(), any(), any());
        assertThat(owner.lastError()).get()
                .extracting(e -> e.data().get("code")).isEqualTo("UNAUTHORIZED");
    }

    @Test
    void startForUnknownSessionReportsNotFound() {
        when(lookup.ownerOf("m9")).thenThrow(new SessionNotFoundException("m9"));

        gateway.onText(owner, "{\"event\":\"stream:start\",\"data\":{\"sessionId\":\"m9\"}}");

        assertThat(owner.lastError()).get()
                .extracting(e -> e.data().get("code")).isEqualTo("SESSION_NOT_FOUND");
    }

    @Test
    void lookupFailureOnStartReportsStartFailed() {
        when(lookup.ownerOf("m1")).thenThrow(new IllegalStateException("meeting service down"));

        gateway.onText(owner, "{\"event\":\"stream:start\",\"data\":{\"sessionId\":\"m1\"}}");

        assertThat(owner.lastError()).get()
                .extracting(e -> e.data().get("code")).isEqualTo("START_FAILED");
    }

    @Test
    void audioStopAndLeaveGoStraightToCoordinator() {
        String audio = Base64.getEncoder().encodeToString(new byte[]{9});

        gateway.onText(owner, "{\"event\":\"stream:audio\",\"data\":{\"sessionId\":\"m1\",\"audio\":\"" + audio + "\"}}");
        gateway.onText(owner, "{\"event\":\"stream:stop\",\"data\":{\"sessionId\":\"m1\"}}");
        gateway.onText(owner, "{\"event\":\"stream:leave\"}");

        verify(coordinator).audio(eq(owner), eq("m1"), eq(new byte[]{9}));
        verify(coordinator).stop(owner, "m1");
        verify(coordinator).leave(owner);
        verifyNoInteractions(lookup);
    }

    @Test
    void permittedObserverJoins() {
        FakeClientConnection listener = new FakeClientConnection("c2", "u2");
        when(lookup.canObserve("m1", Identity.of("u2"))).thenReturn(true);

        gateway.onText(listener, "{\"event\":\"stream:join\",\"data\":{\"sessionId\":\"m1\"}}");

        verify(coordinator).join(listener, "m1");
    }

    @Test
    void forbiddenObserverIsRejected() {
        FakeClientConnection listener = new FakeClientConnection("c2", "u2");
        when(lookup.canObserve("m1", Identity.of("u2"))).thenReturn(false);

        gateway.onText(listener, "{\"event\":\"stream:join\",\"data\":{\"sessionId\":\"m1\"}}");

        verify(coordinator, never()).join(any(), any());
        assertThat(listener.lastError()).get()
                .extracting(e -> e.data().get("code")).isEqualTo("UNAUTHORIZED");
    }

    @Test
    void joinLookupFailuresAreReported() {
        FakeClientConnection listener = new FakeClientConnection("c2", "u2");
        when(lookup.canObserve(eq("m9"), any())).thenThrow(new SessionNotFoundException("m9"));
        when(lookup.canObserve(eq("m1"), any())).thenThrow(new IllegalStateException("down"));

        gateway.onText(listener, "{\"event\":\"stream:join\",\"data\":{\"sessionId\":\"m9\"}}");
        gateway.onText(listener, "{\"event\":\"stream:join\",\"data\":{\"sessionId\":\"m1\"}}");

        assertThat(listener.received(OutboundEvent.ERROR))
                .extracting(e -> e.data().get("code"))
                .containsExactly("SESSION_NOT_FOUND", "NOT_ACTIVE");
    }

    @Test
    void malformedAndUnknownEventsKeepConnectionOpen() {
        gateway.onText(owner, "{oops");
        gateway.onText(owner, "{\"event\":\"stream:rewind\"}");

        assertThat(owner.received(OutboundEvent.ERROR))
                .extracting(e -> e.data().get("code"))
                .containsExactly("MALFORMED_EVENT", "UNKNOWN_EVENT");
        assertThat(owner.isOpen()).isTrue();
        verifyNoInteractions(coordinator);
    }

    @Test
    void binaryFrameWithoutRoomIsRejected() {
        gateway.onBinary(owner, new byte[]{1});

        verify(coordinator, never()).audio(any(), any(), any());
        assertThat(owner.lastError()).get()
                .extracting(e -> e.data().get("code")).isEqualTo("NOT_ACTIVE");
    }

    @Test
    void binaryFrameGoesToBoundSession() {
        owner.bindRoom("m1");

        gateway.onBinary(owner, new byte[]{1, 2});

        verify(coordinator).audio(eq(owner), eq("m1"), eq(new byte[]{1, 2}));
    }

    @Test
    void disconnectNotifiesCoordinatorAndUnregisters() {
        gateway.onDisconnect(owner);

        verify(coordinator).connectionClosed(owner);
        assertThat(broadcaster.connection("c1")).isEmpty();
    }
}
