package com.phillippitts.livescribe.service.coordinator.event;

import java.time.Instant;

/**
 * Published when a session reaches ACTIVE.
 *
 * @param sessionId session id
 * @param userId    owner
 * @param provider  recognition provider serving the session
 * @param at        when the upstream stream opened
 */
public record SessionStartedEvent(String sessionId, String userId, String provider, Instant at) {
    public SessionStartedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
