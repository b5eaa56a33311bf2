package com.phillippitts.livescribe.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link UpstreamException} and {@link UpstreamUnavailableException} with
 * contextual metadata folded into the message.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Handshake rejected
 * throw UpstreamExceptionBuilder.create("Upstream rejected connection")
 *         .provider("deepgram")
 *         .kind(UpstreamErrorKind.AUTH_FAILURE)
 *         .httpStatus(401)
 *         .metadata("sessionId", sessionId)
 *         .buildUnavailable();
 *
 * // Stream dropped mid-session
 * stream.fail(UpstreamExceptionBuilder.create("Upstream closed stream")
 *         .provider("deepgram")
 *         .kind(UpstreamErrorKind.TRANSIENT)
 *         .closeCode(1011)
 *         .build());
 * </pre>
 */
public final class UpstreamExceptionBuilder {

    private final String message;
    private String providerName;
    private UpstreamErrorKind kind = UpstreamErrorKind.UNKNOWN;
    private Throwable cause;
    private Integer httpStatus;
    private Integer closeCode;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private UpstreamExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static UpstreamExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new UpstreamExceptionBuilder(message);
    }

    public UpstreamExceptionBuilder provider(String providerName) {
        this.providerName = providerName;
        return this;
    }

    public UpstreamExceptionBuilder kind(UpstreamErrorKind kind) {
        if (kind != null) {
            this.kind = kind;
        }
        return this;
    }

    public UpstreamExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the HTTP status of a failed upgrade. Also derives the kind unless one was set explicitly.
     *
     * @param httpStatus HTTP status code
     * @return this builder for chaining
     */
    public UpstreamExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        if (kind == UpstreamErrorKind.UNKNOWN) {
            kind = UpstreamErrorKind.fromHttpStatus(httpStatus);
        }
        return this;
    }

    /**
     * Sets the WebSocket close code. Also derives the kind unless one was set explicitly.
     *
     * @param closeCode close status code
     * @return this builder for chaining
     */
    public UpstreamExceptionBuilder closeCode(int closeCode) {
        this.closeCode = closeCode;
        if (kind == UpstreamErrorKind.UNKNOWN) {
            kind = UpstreamErrorKind.fromCloseCode(closeCode);
        }
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     *
     * @param key metadata key
     * @param value metadata value (ignored when null)
     * @return this builder for chaining
     */
    public UpstreamExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public UpstreamException build() {
        return new UpstreamException(kind, buildDetailedMessage(), provider(), cause);
    }

    public UpstreamUnavailableException buildUnavailable() {
        return new UpstreamUnavailableException(kind, buildDetailedMessage(), provider(), cause);
    }

    private String provider() {
        return providerName != null ? providerName : "unknown";
    }

    private String buildDetailedMessage() {
        boolean hasDetails = httpStatus != null || closeCode != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" [");
        boolean first = true;

        if (httpStatus != null) {
            sb.append("httpStatus=").append(httpStatus);
            first = false;
        }

        if (closeCode != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("closeCode=").append(closeCode);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        return sb.append("]").toString();
    }
}
