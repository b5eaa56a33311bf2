package com.phillippitts.livescribe.service.coordinator.event;

import java.time.Instant;

/**
 * Published once per session after teardown completed and the registry entry was removed.
 *
 * <p>PII note: carries transcript size only, never transcript text.
 *
 * @param sessionId       session id
 * @param outcome         how the session ended
 * @param finalFragments  number of buffered final fragments
 * @param transcriptChars length of the joined transcript
 * @param persisted       whether the transcript was stored
 * @param at              completion time
 */
public record SessionClosedEvent(
        String sessionId,
        Outcome outcome,
        int finalFragments,
        int transcriptChars,
        boolean persisted,
        Instant at
) {

    public enum Outcome {
        STOPPED, DISCONNECTED, FAILED, SHUTDOWN;

        public String tag() {
            return name().toLowerCase();
        }
    }

    public SessionClosedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
