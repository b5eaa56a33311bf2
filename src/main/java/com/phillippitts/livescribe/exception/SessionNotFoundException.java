package com.phillippitts.livescribe.exception;

/**
 * Thrown when a session id is unknown, either to the ownership lookup or to the live registry.
 */
public class SessionNotFoundException extends LiveScribeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
