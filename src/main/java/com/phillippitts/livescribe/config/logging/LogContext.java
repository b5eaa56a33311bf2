package com.phillippitts.livescribe.config.logging;

import org.apache.logging.log4j.CloseableThreadContext;

/**
 * MDC keys and helpers for WebSocket and session threads.
 *
 * <p>HTTP requests get their context from {@link MdcFilter}. WebSocket callbacks run outside the
 * servlet filter chain, so the handler scopes {@code connectionId}, {@code userId} and
 * {@code sessionId} around each callback with {@link #forConnection}:
 * <pre>
 * try (CloseableThreadContext.Instance ctx = LogContext.forConnection(connectionId, userId)) {
 *     ctx.put(LogContext.SESSION_ID, sessionId);
 *     ...
 * }
 * </pre>
 */
public final class LogContext {

    public static final String REQUEST_ID = "requestId";
    public static final String USER_ID = "userId";
    public static final String METHOD = "method";
    public static final String URI = "uri";
    public static final String CONNECTION_ID = "connectionId";
    public static final String SESSION_ID = "sessionId";

    private LogContext() {
    }

    /**
     * Puts connection-scoped keys and restores the previous values on close.
     *
     * @param connectionId transport connection id
     * @param userId       authenticated user (may be null)
     */
    public static CloseableThreadContext.Instance forConnection(String connectionId, String userId) {
        CloseableThreadContext.Instance ctx = CloseableThreadContext.put(CONNECTION_ID, connectionId);
        if (userId != null) {
            ctx.put(USER_ID, userId);
        }
        return ctx;
    }
}
