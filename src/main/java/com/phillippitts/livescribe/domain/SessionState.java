package com.phillippitts.livescribe.domain;

/**
 * Lifecycle states of a live transcription session.
 *
 * <pre>
 * IDLE → STARTING → ACTIVE → STOPPING → CLOSED
 *           ↓                    ↑
 *         CLOSED (open failed)   └── also from STARTING on shutdown
 * </pre>
 *
 * <p>{@link #CLOSED} is terminal; a session id is reused only by creating a new session.
 */
public enum SessionState {
    IDLE,
    STARTING,
    ACTIVE,
    STOPPING,
    CLOSED;

    /**
     * Checks whether the state machine permits moving from this state to {@code next}.
     *
     * @param next target state
     * @return {@code true} if the transition is legal
     */
    public boolean canTransitionTo(SessionState next) {
        return switch (this) {
            case IDLE -> next == STARTING || next == CLOSED;
            case STARTING -> next == ACTIVE || next == STOPPING || next == CLOSED;
            case ACTIVE -> next == STOPPING;
            case STOPPING -> next == CLOSED;
            case CLOSED -> false;
        };
    }

    /**
     * @return {@code true} while the session still holds (or is acquiring) an upstream stream
     */
    public boolean isLive() {
        return this == STARTING || this == ACTIVE;
    }
}
