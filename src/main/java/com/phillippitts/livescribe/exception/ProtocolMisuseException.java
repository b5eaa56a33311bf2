package com.phillippitts.livescribe.exception;

/**
 * Thrown when a client sends an event the protocol does not allow in the current state
 * ({@code audio} before {@code start}, {@code stop} on an unknown session, malformed frames).
 * Never fatal to the connection.
 */
public class ProtocolMisuseException extends LiveScribeException {

    public ProtocolMisuseException(String message) {
        super(message);
    }

    public ProtocolMisuseException(String message, Throwable cause) {
        super(message, cause);
    }
}
