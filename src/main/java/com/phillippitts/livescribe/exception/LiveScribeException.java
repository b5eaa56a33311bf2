package com.phillippitts.livescribe.exception;

/**
 * Base exception for all LiveScribe application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class LiveScribeException extends RuntimeException {

    public LiveScribeException(String message) {
        super(message);
    }

    public LiveScribeException(String message, Throwable cause) {
        super(message, cause);
    }

    public LiveScribeException(Throwable cause) {
        super(cause);
    }
}
