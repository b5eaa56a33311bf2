package com.phillippitts.livescribe.exception;

/**
 * Thrown when an authenticated caller acts on a session it does not own (or may not observe).
 * Session state is never changed by a rejected request.
 */
public class SessionAccessDeniedException extends LiveScribeException {

    private final String sessionId;
    private final String userId;

    public SessionAccessDeniedException(String sessionId, String userId) {
        super("User " + userId + " is not authorized for session " + sessionId);
        this.sessionId = sessionId;
        this.userId = userId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }
}
