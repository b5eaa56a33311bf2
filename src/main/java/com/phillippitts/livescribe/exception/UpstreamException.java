package com.phillippitts.livescribe.exception;

import java.util.Objects;

/**
 * Thrown (or reported as a stream's terminal error) when the upstream recognition provider fails:
 * authentication, rate limiting, malformed payloads or connection loss.
 *
 * <p>Distinct from {@link StreamClosedException}, which only means the local handle is closed.
 */
public class UpstreamException extends LiveScribeException {

    private final UpstreamErrorKind kind;
    private final String detail;
    private final String providerName;

    public UpstreamException(UpstreamErrorKind kind, String detail) {
        this(kind, detail, "unknown", null);
    }

    public UpstreamException(UpstreamErrorKind kind, String detail, String providerName, Throwable cause) {
        super(detail + " (provider: " + providerName + ", kind: " + kind + ")", cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.detail = detail;
        this.providerName = providerName;
    }

    public UpstreamErrorKind getKind() {
        return kind;
    }

    public String getDetail() {
        return detail;
    }

    public String getProviderName() {
        return providerName;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
