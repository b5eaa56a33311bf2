package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the meeting application's internal API, which owns meeting ownership
 * and transcript storage.
 *
 * @param baseUrl            base URL of the internal API
 * @param serviceToken       shared service credential sent on every call
 * @param serviceTokenHeader header carrying {@code serviceToken}
 * @param connectTimeout     TCP connect timeout
 * @param readTimeout        response timeout
 */
@ConfigurationProperties(prefix = "livescribe.collaborator")
@Validated
public record CollaboratorProperties(
        @NotBlank @DefaultValue("http://localhost:3000") String baseUrl,
        @DefaultValue("") String serviceToken,
        @NotBlank @DefaultValue("X-Service-Token") String serviceTokenHeader,
        @NotNull @DefaultValue("2s") Duration connectTimeout,
        @NotNull @DefaultValue("5s") Duration readTimeout
) {
}
