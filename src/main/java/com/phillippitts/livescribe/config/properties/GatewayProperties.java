package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Client-facing WebSocket endpoint settings.
 *
 * <p>Example application.properties:
 * <pre>
 * livescribe.gateway.path=/ws/transcription
 * livescribe.gateway.allowed-origins=https://app.example.com
 * livescribe.gateway.max-binary-message-bytes=262144
 * </pre>
 *
 * @param path                  WebSocket endpoint path
 * @param allowedOrigins        origins allowed to open the socket ({@code *} allows any)
 * @param maxTextMessageBytes   container buffer for JSON frames (base64 audio included)
 * @param maxBinaryMessageBytes container buffer for raw audio frames
 * @param idleTimeout           connection idle timeout
 * @param sendTimeLimit         bound on one blocked send to a slow client
 * @param sendBufferLimit       bytes buffered for a slow client before it is disconnected
 */
@ConfigurationProperties(prefix = "livescribe.gateway")
@Validated
public record GatewayProperties(
        @NotBlank @DefaultValue("/ws/transcription") String path,
        @NotNull @DefaultValue("*") List<String> allowedOrigins,
        @Min(1024) @DefaultValue("1048576") int maxTextMessageBytes,
        @Min(1024) @DefaultValue("262144") int maxBinaryMessageBytes,
        @NotNull @DefaultValue("5m") Duration idleTimeout,
        @NotNull @DefaultValue("5s") Duration sendTimeLimit,
        @Min(1024) @DefaultValue("524288") int sendBufferLimit
) {
}
