package com.phillippitts.livescribe.exception;

/**
 * Thrown when a streaming connection presents a missing, malformed, expired or
 * wrongly-signed identity token. The connection is rejected before any session interaction.
 */
public class InvalidTokenException extends LiveScribeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
