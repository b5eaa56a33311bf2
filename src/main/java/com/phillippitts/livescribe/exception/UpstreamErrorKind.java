package com.phillippitts.livescribe.exception;

/**
 * Categories of upstream recognition failures. The category decides whether a fresh
 * {@code start} is worth attempting.
 */
public enum UpstreamErrorKind {
    /** Provider rejected the credentials. */
    AUTH_FAILURE(false),
    /** Provider throttled the request. */
    RATE_LIMITED(true),
    /** Request or response payload could not be understood. */
    MALFORMED_PAYLOAD(false),
    /** Network drop, timeout or provider-side hiccup. */
    TRANSIENT(true),
    UNKNOWN(false);

    private final boolean retryable;

    UpstreamErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Maps an HTTP status returned during the WebSocket upgrade.
     *
     * @param status HTTP status code
     * @return matching kind
     */
    public static UpstreamErrorKind fromHttpStatus(int status) {
        if (status == 401 || status == 403) {
            return AUTH_FAILURE;
        }
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status == 400 || status == 413 || status == 415) {
            return MALFORMED_PAYLOAD;
        }
        if (status >= 500) {
            return TRANSIENT;
        }
        return UNKNOWN;
    }

    /**
     * Maps a WebSocket close code sent by the provider.
     *
     * @param code close status code (1000 is not an error and is never passed here)
     * @return matching kind
     */
    public static UpstreamErrorKind fromCloseCode(int code) {
        return switch (code) {
            case 1003, 1007, 1008, 1009 -> MALFORMED_PAYLOAD;
            case 4001, 4003 -> AUTH_FAILURE;
            case 4029 -> RATE_LIMITED;
            default -> TRANSIENT;
        };
    }
}
