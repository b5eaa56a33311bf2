package com.phillippitts.livescribe.presentation.websocket;

import com.phillippitts.livescribe.domain.Identity;
import com.phillippitts.livescribe.exception.InvalidTokenException;
import com.phillippitts.livescribe.service.gateway.ConnectionGateway;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;
import java.util.Objects;

/**
 * Authenticates the WebSocket upgrade request.
 *
 * <p>The token comes from the {@code token} query parameter or an {@code Authorization: Bearer}
 * header. A missing or invalid token fails the upgrade with HTTP 401; on success the verified
 * {@link Identity} is stored in the session attributes under {@link #IDENTITY_ATTRIBUTE}.
 */
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger LOG = LogManager.getLogger(TokenHandshakeInterceptor.class);

    static final String IDENTITY_ATTRIBUTE = "livescribe.identity";
    static final String TOKEN_PARAM = "token";
    private static final String BEARER_PREFIX = "Bearer ";

    private final ConnectionGateway gateway;

    public TokenHandshakeInterceptor(ConnectionGateway gateway) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        try {
            Identity identity = gateway.authenticate(extractToken(request));
            attributes.put(IDENTITY_ATTRIBUTE, identity);
            return true;
        } catch (InvalidTokenException e) {
            LOG.warn("Rejected WebSocket handshake from {}: {}", request.getRemoteAddress(), e.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               Exception exception) {
        if (exception != null) {
            LOG.warn("WebSocket handshake failed: {}", exception.toString());
        }
    }

    /**
     * @return token from the query string, else from the bearer header, else null
     */
    static String extractToken(ServerHttpRequest request) {
        String fromQuery = UriComponentsBuilder.fromUri(request.getURI())
                .build()
                .getQueryParams()
                .getFirst(TOKEN_PARAM);
        if (fromQuery != null && !fromQuery.isBlank()) {
            return fromQuery;
        }
        String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }
}
