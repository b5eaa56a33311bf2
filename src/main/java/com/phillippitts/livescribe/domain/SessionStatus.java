package com.phillippitts.livescribe.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time view of a live session for status reporting.
 *
 * @param sessionId      session id
 * @param state          current lifecycle state
 * @param createdAt      when the session was registered
 * @param finalFragments number of buffered final fragments
 */
public record SessionStatus(String sessionId, SessionState state, Instant createdAt, int finalFragments) {
    public SessionStatus {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
