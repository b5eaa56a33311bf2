package com.phillippitts.livescribe.presentation.exception;

import com.phillippitts.livescribe.exception.InvalidTokenException;
import com.phillippitts.livescribe.exception.SessionAccessDeniedException;
import com.phillippitts.livescribe.exception.SessionNotFoundException;
import com.phillippitts.livescribe.exception.UpstreamException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST boundary.
 *
 * Converts domain exceptions to HTTP responses. Exception messages stay in the log;
 * clients get a fixed message per error type.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOG.debug("Session not found: {}", ex.getSessionId());
        return error(HttpStatus.NOT_FOUND, ex, "Session not found", "No live session with id " + ex.getSessionId());
    }

    @ExceptionHandler(SessionAccessDeniedException.class)
    ResponseEntity<ApiError> handleAccessDenied(SessionAccessDeniedException ex) {
        LOG.warn("Access denied: sessionId={}, userId={}", ex.getSessionId(), ex.getUserId());
        return error(HttpStatus.FORBIDDEN, ex, "Access denied", "Caller does not own this session");
    }

    @ExceptionHandler(InvalidTokenException.class)
    ResponseEntity<ApiError> handleInvalidToken(InvalidTokenException ex) {
        LOG.warn("Rejected token: {}", ex.getMessage());
        return error(HttpStatus.UNAUTHORIZED, ex, "Authentication required", "Provide a valid bearer token");
    }

    /**
     * Recognition provider failure (HTTP 503); retry possible when the kind is retryable.
     */
    @ExceptionHandler(UpstreamException.class)
    ResponseEntity<ApiError> handleUpstream(UpstreamException ex) {
        LOG.error("Upstream failure: provider={}, kind={}", ex.getProviderName(), ex.getKind(), ex);
        String details = ex.isRetryable() ? "Please retry in a few seconds" : "Contact administrator";
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Recognition service unavailable", details);
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex, "Internal server error",
                "An unexpected error occurred");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
                .status(status)
                .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    /**
     * Standard error response body.
     */
    record ApiError(
            String errorCode,
            String message,
            String details,
            Instant timestamp
    ) {
    }
}
