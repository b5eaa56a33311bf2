package com.phillippitts.livescribe.config.recognition;

import com.phillippitts.livescribe.domain.RecognitionConfig;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the Deepgram live recognition endpoint.
 * Binds to properties prefixed with "recognition.deepgram".
 *
 * <p>Example application.properties:
 * <pre>
 * recognition.deepgram.api-key=${DEEPGRAM_API_KEY:}
 * recognition.deepgram.url=wss://api.deepgram.com/v1/listen
 * recognition.deepgram.model=nova-2
 * recognition.deepgram.connect-timeout=10s
 * </pre>
 *
 * @param apiKey            provider API key; blank keeps the service up but reports it unhealthy
 * @param url               live endpoint URL
 * @param model             default model
 * @param language          default language tag
 * @param punctuate         add punctuation
 * @param diarize           tag words with speaker indices
 * @param smartFormat       provider formatting of numbers and dates
 * @param interimResults    emit interim fragments
 * @param endpointingMs     silence in ms that finalizes an utterance
 * @param connectTimeout    bound on the upgrade handshake
 * @param keepAliveInterval idle time after which a KeepAlive message is sent
 * @param sendTimeLimit     bound on a single blocked write to the provider
 * @param sendBufferLimit   bytes buffered for a slow provider before the stream is failed
 */
@ConfigurationProperties(prefix = "recognition.deepgram")
@Validated
public record DeepgramProperties(
        @DefaultValue("") String apiKey,

        @NotBlank(message = "Deepgram URL must not be blank")
        @DefaultValue("wss://api.deepgram.com/v1/listen")
        String url,

        @NotBlank @DefaultValue("nova-2") String model,
        @NotBlank @DefaultValue("en") String language,
        @DefaultValue("true") boolean punctuate,
        @DefaultValue("true") boolean diarize,
        @DefaultValue("true") boolean smartFormat,
        @DefaultValue("true") boolean interimResults,

        @Min(value = 0, message = "Endpointing must not be negative")
        @DefaultValue("300")
        int endpointingMs,

        @NotNull @DefaultValue("10s") Duration connectTimeout,
        @NotNull @DefaultValue("5s") Duration keepAliveInterval,
        @NotNull @DefaultValue("5s") Duration sendTimeLimit,

        @Min(value = 1024, message = "Send buffer limit must be at least 1 KiB")
        @DefaultValue("524288")
        int sendBufferLimit
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * @return provider-level recognition defaults, before per-stream overrides
     */
    public RecognitionConfig toRecognitionConfig() {
        return new RecognitionConfig(model, language, punctuate, diarize, smartFormat,
                interimResults, endpointingMs, null, null, null);
    }
}
