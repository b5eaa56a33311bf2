package com.phillippitts.livescribe.presentation.controller;

import com.phillippitts.livescribe.config.logging.LogContext;
import com.phillippitts.livescribe.service.coordinator.SessionCoordinator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cheap reachability check for load balancers and client diagnostics.
 *
 * <p>Answers with the request id assigned by {@code MdcFilter}, so a client report can be matched
 * to the server log line.
 */
@RestController
class PingController {

    private static final Logger log = LogManager.getLogger(PingController.class);

    private final SessionCoordinator coordinator;

    PingController(SessionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        int active = coordinator.activeSessionCount();
        log.info("Ping (activeSessions={})", active);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("requestId", ThreadContext.get(LogContext.REQUEST_ID));
        body.put("activeSessions", active);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }
}
