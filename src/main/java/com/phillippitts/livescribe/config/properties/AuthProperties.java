package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Token verification settings for streaming connections.
 *
 * @param jwtSecret   HMAC-SHA256 shared secret of the token issuer (at least 32 bytes)
 * @param userIdClaim claim carrying the user id; {@code sub} is used when it is absent
 */
@ConfigurationProperties(prefix = "livescribe.auth")
@Validated
public record AuthProperties(
        @NotBlank(message = "livescribe.auth.jwt-secret must be set") String jwtSecret,
        @NotBlank @DefaultValue("userId") String userIdClaim
) {
}
