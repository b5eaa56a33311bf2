package com.phillippitts.livescribe.exception;

/**
 * Thrown when audio is sent on a recognition handle that has already been closed.
 */
public class StreamClosedException extends LiveScribeException {

    private final String sessionId;

    public StreamClosedException(String sessionId) {
        super("Recognition stream already closed for session " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
