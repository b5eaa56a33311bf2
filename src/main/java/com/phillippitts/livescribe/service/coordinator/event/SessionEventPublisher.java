package com.phillippitts.livescribe.service.coordinator.event;

import com.phillippitts.livescribe.exception.UpstreamErrorKind;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Null-safe helpers for publishing session lifecycle events.
 *
 * <p>A {@code null} publisher makes every method a no-op, which lets coordinator tests run
 * without an application context.
 *
 * @since 1.0
 */
public final class SessionEventPublisher {

    private SessionEventPublisher() {
        // Utility class - prevent instantiation
    }

    public static void publish(ApplicationEventPublisher publisher, Object event) {
        if (publisher != null) {
            publisher.publishEvent(event);
        }
    }

    /**
     * Publishes a {@link SessionFailedEvent}.
     *
     * @param publisher Spring event publisher (may be null)
     * @param sessionId failing session
     * @param phase     failure phase
     * @param kind      upstream kind (may be null)
     * @param message   technical description
     * @param context   extra diagnostics (may be null)
     */
    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String sessionId,
                                      SessionFailedEvent.Phase phase,
                                      UpstreamErrorKind kind,
                                      String message,
                                      Map<String, String> context) {
        publish(publisher, new SessionFailedEvent(sessionId, phase, kind, message, Instant.now(), context));
    }
}
