package com.phillippitts.livescribe.service.collaborator;

import com.phillippitts.livescribe.config.properties.AuthProperties;
import com.phillippitts.livescribe.domain.Identity;
import com.phillippitts.livescribe.exception.InvalidTokenException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link IdentityVerifier} for HS256 tokens issued by the meeting application.
 *
 * <p>Signature, {@code exp} and {@code nbf} are checked by Spring Security's
 * {@link NimbusJwtDecoder}. The user id is read from the configured claim ({@code userId} by
 * default) and falls back to {@code sub}.
 *
 * @since 1.0
 */
public class JwtIdentityVerifier implements IdentityVerifier {

    private static final Logger LOG = LogManager.getLogger(JwtIdentityVerifier.class);

    /** HS256 needs a key at least as long as the hash output. */
    static final int MIN_SECRET_BYTES = 32;

    private final JwtDecoder decoder;
    private final String userIdClaim;

    public JwtIdentityVerifier(AuthProperties properties) {
        this(hs256Decoder(properties.jwtSecret()), properties.userIdClaim());
    }

    JwtIdentityVerifier(JwtDecoder decoder, String userIdClaim) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.userIdClaim = Objects.requireNonNull(userIdClaim, "userIdClaim");
    }

    @Override
    public Identity verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Authentication required");
        }
        Jwt jwt;
        try {
            jwt = decoder.decode(token);
        } catch (JwtException e) {
            LOG.debug("Token rejected: {}", e.getMessage());
            throw new InvalidTokenException("Invalid token", e);
        }
        String userId = jwt.getClaimAsString(userIdClaim);
        if (userId == null || userId.isBlank()) {
            userId = jwt.getSubject();
        }
        if (userId == null || userId.isBlank()) {
            throw new InvalidTokenException("Token carries no user id");
        }
        return Identity.of(userId);
    }

    static JwtDecoder hs256Decoder(String secret) {
        byte[] bytes = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "livescribe.auth.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes, got " + bytes.length);
        }
        SecretKey key = new SecretKeySpec(bytes, "HmacSHA256");
        return NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
    }
}
