package com.phillippitts.livescribe.exception;

/**
 * Thrown by {@code open} when no upstream recognition stream could be established.
 */
public class UpstreamUnavailableException extends UpstreamException {

    public UpstreamUnavailableException(UpstreamErrorKind kind, String detail, String providerName, Throwable cause) {
        super(kind, detail, providerName, cause);
    }
}
