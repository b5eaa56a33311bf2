package com.phillippitts.livescribe.service.gateway;

/**
 * Stable client-facing reasons carried by {@code stream:error}. Clients may match on
 * {@link #code()}; {@link #message()} is human-readable. Exception detail never reaches clients.
 */
public enum StreamErrorReason {
    ALREADY_ACTIVE("already active"),
    UNAUTHORIZED("unauthorized"),
    SESSION_NOT_FOUND("session not found"),
    NOT_ACTIVE("no active stream"),
    START_FAILED("failed to start stream"),
    AUDIO_FAILED("failed to process audio"),
    UPSTREAM_FAILED("transcription stream failed"),
    MALFORMED_EVENT("malformed event"),
    UNKNOWN_EVENT("unknown event");

    private final String message;

    StreamErrorReason(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }

    public String code() {
        return name();
    }
}
