package com.phillippitts.livescribe.service.events;

import com.phillippitts.livescribe.service.coordinator.event.SessionFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized operator-facing logging of session failures. Privacy-safe and throttled per
 * failure category so a provider outage does not flood the log with one line per session.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onSessionFailed(SessionFailedEvent e) {
        String key = "session-" + e.phase() + '-' + e.kind();
        if (!shouldLog(key)) {
            return;
        }
        switch (e.phase()) {
            case START -> LOG.warn("Sessions failing to start: kind={}, lastSession={}. {}",
                    e.kind(), e.sessionId(), hint(e));
            case STREAM -> LOG.warn("Recognition streams failing mid-session: kind={}, lastSession={}. {}",
                    e.kind(), e.sessionId(), hint(e));
            case PERSIST -> LOG.error("Transcripts failing to persist: lastSession={}. "
                    + "Check livescribe.collaborator.* and the meeting API.", e.sessionId());
        }
    }

    private static String hint(SessionFailedEvent e) {
        if (e.kind() == null) {
            return "";
        }
        return switch (e.kind()) {
            case AUTH_FAILURE -> "Check recognition.deepgram.api-key.";
            case RATE_LIMITED -> "Provider is throttling; reduce concurrent sessions or raise the plan limit.";
            case MALFORMED_PAYLOAD -> "Check client audio encoding and stream options.";
            case TRANSIENT -> "Provider or network unstable; clients may retry.";
            case UNKNOWN -> "See earlier session logs for details.";
        };
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
