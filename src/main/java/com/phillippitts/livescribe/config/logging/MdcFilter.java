package com.phillippitts.livescribe.config.logging;

import com.phillippitts.livescribe.util.LogSanitizer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) for structured logging.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID when it is a plain token of at most 64 characters,
 *       otherwise a generated UUID; echoed on the response</li>
 *   <li>userId: from X-User-ID header (if present, truncated)</li>
 *   <li>method: HTTP method</li>
 *   <li>uri: request path without the query string, which may carry a bearer token</li>
 * </ul>
 *
 * <p>Also runs for the WebSocket upgrade request, so handshake rejections carry a requestId.
 * The context is always cleared afterwards.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String USER_ID_HEADER = "X-User-ID";

    private static final int MAX_HEADER_VALUE = 64;
    private static final Pattern SAFE_REQUEST_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        try {
            String requestId = requestId(request.getHeader(REQUEST_ID_HEADER));
            ThreadContext.put(LogContext.REQUEST_ID, requestId);
            response.setHeader(REQUEST_ID_HEADER, requestId);

            String userId = request.getHeader(USER_ID_HEADER);
            if (userId != null && !userId.isBlank()) {
                ThreadContext.put(LogContext.USER_ID, LogSanitizer.truncate(userId.strip(), MAX_HEADER_VALUE));
            }

            ThreadContext.put(LogContext.METHOD, request.getMethod());
            ThreadContext.put(LogContext.URI, request.getRequestURI());
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    static String requestId(String header) {
        if (header != null && SAFE_REQUEST_ID.matcher(header).matches()) {
            return header;
        }
        return UUID.randomUUID().toString();
    }
}
