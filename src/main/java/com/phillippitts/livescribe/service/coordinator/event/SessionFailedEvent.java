package com.phillippitts.livescribe.service.coordinator.event;

import com.phillippitts.livescribe.exception.UpstreamErrorKind;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a session fails to start, loses its upstream stream or cannot persist its
 * transcript.
 *
 * <p>PII note: do not include transcript text in context. Restrict to technical diagnostics.
 *
 * @param sessionId session id
 * @param phase     where the failure happened
 * @param kind      upstream failure category, {@code null} for persistence failures
 * @param message   technical description
 * @param at        failure time
 * @param context   extra diagnostics (may be empty)
 */
public record SessionFailedEvent(
        String sessionId,
        Phase phase,
        UpstreamErrorKind kind,
        String message,
        Instant at,
        Map<String, String> context
) {

    public enum Phase { START, STREAM, PERSIST }

    public SessionFailedEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
