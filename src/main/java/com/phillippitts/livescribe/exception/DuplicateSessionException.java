package com.phillippitts.livescribe.exception;

/**
 * Thrown when {@code start} targets a session id that already has a live session.
 */
public class DuplicateSessionException extends LiveScribeException {

    private final String sessionId;

    public DuplicateSessionException(String sessionId) {
        super("Session already active: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
