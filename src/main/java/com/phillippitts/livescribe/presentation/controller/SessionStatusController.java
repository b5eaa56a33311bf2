package com.phillippitts.livescribe.presentation.controller;

import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.exception.SessionNotFoundException;
import com.phillippitts.livescribe.service.coordinator.SessionCoordinator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view of live sessions for operators and the collaborator service.
 *
 * <p>Only live sessions are visible. A session that has been torn down answers 404, the same as
 * one that never existed.
 */
@RestController
@RequestMapping("/api/sessions")
class SessionStatusController {

    private final SessionCoordinator coordinator;

    SessionStatusController(SessionCoordinator coordinator) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    }

    @GetMapping
    ResponseEntity<Map<String, Object>> summary() {
        return ResponseEntity.ok(Map.of("active", coordinator.activeSessionCount()));
    }

    @GetMapping("/{sessionId}")
    ResponseEntity<Map<String, Object>> status(@PathVariable String sessionId) {
        SessionStatus status = coordinator.status(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", status.sessionId());
        body.put("state", status.state().name());
        body.put("createdAt", status.createdAt().toString());
        body.put("finalFragments", status.finalFragments());
        return ResponseEntity.ok(body);
    }
}
