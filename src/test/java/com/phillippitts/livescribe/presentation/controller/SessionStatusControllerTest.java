package com.phillippitts.livescribe.presentation.controller;

import com.phillippitts.livescribe.domain.SessionState;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.exception.SessionNotFoundException;
import com.phillippitts.livescribe.service.coordinator.SessionCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionStatusControllerTest {

    private SessionCoordinator coordinator;
    private SessionStatusController controller;

    @BeforeEach
    void setUp() {
        coordinator = mock(SessionCoordinator.class);
        controller = new SessionStatusController(coordinator);
    }

    @Test
    void summaryReportsActiveCount() {
        when(coordinator.activeSessionCount()).thenReturn(2);

        assertThat(controller.summary().getBody()).containsEntry("active", 2);
    }

    @Test
    void statusReportsLiveSession() {
        Instant createdAt = Instant.parse("2026-01-05T10:00:00Z");
        when(coordinator.status("m1"))
                .thenReturn(Optional.of(new SessionStatus("m1", SessionState.ACTIVE, createdAt, 4)));

        Map<String, Object> body = controller.status("m1").getBody();

        assertThat(body)
                .containsEntry("sessionId", "m1")
                .containsEntry("state", "ACTIVE")
                .containsEntry("createdAt", "2026-01-05T10:00:00Z")
                .containsEntry("finalFragments", 4);
    }

    @Test
    void statusOfUnknownSessionThrowsNotFound() {
        when(coordinator.status("gone")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> controller.status("gone")).isInstanceOf(SessionNotFoundException.class);
    }
}
