package com.phillippitts.livescribe.exception;

/**
 * Thrown when the transcript persistence collaborator fails to store a final transcript.
 * Session teardown always completes regardless.
 */
public class PersistenceException extends LiveScribeException {

    private final String sessionId;

    public PersistenceException(String sessionId, String message, Throwable cause) {
        super(message + " (session: " + sessionId + ")", cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
