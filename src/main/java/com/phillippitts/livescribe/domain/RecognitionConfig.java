package com.phillippitts.livescribe.domain;

import java.util.Objects;

/**
 * Settings for one upstream recognition stream.
 *
 * <p>Defaults come from {@code recognition.deepgram.*}; {@link #applying(StreamOptions)} layers the
 * client's per-stream choices on top.
 *
 * @param model          provider model (e.g. {@code nova-2})
 * @param language       language tag (e.g. {@code en})
 * @param punctuate      add punctuation
 * @param diarize        tag words with speaker indices
 * @param smartFormat    apply provider formatting (numbers, dates)
 * @param interimResults emit interim fragments
 * @param endpointingMs  silence in ms that finalizes an utterance; 0 disables
 * @param encoding       raw audio encoding, {@code null} for containerized audio
 * @param sampleRate     sample rate in Hz, {@code null} when implied by the container
 * @param channels       channel count, {@code null} when implied by the container
 */
public record RecognitionConfig(
        String model,
        String language,
        boolean punctuate,
        boolean diarize,
        boolean smartFormat,
        boolean interimResults,
        int endpointingMs,
        String encoding,
        Integer sampleRate,
        Integer channels
) {

    public RecognitionConfig {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(language, "language must not be null");
        if (endpointingMs < 0) {
            throw new IllegalArgumentException("endpointingMs must not be negative, got: " + endpointingMs);
        }
    }

    /**
     * Provider defaults: nova-2, English, all formatting on,
     * interim results on, 300 ms endpointing.
     */
    public static RecognitionConfig defaults() {
        return new RecognitionConfig("nova-2", "en", true, true, true, true, 300, null, null, null);
    }

    /**
     * Returns a copy with every non-null option from {@code options} applied.
     *
     * @param options client-supplied overrides (may be null)
     * @return merged configuration
     */
    public RecognitionConfig applying(StreamOptions options) {
        if (options == null) {
            return this;
        }
        return new RecognitionConfig(
                options.model() != null ? options.model() : model,
                options.language() != null ? options.language() : language,
                punctuate,
                diarize,
                smartFormat,
                interimResults,
                endpointingMs,
                options.encoding() != null ? options.encoding() : encoding,
                options.sampleRate() != null ? options.sampleRate() : sampleRate,
                options.channels() != null ? options.channels() : channels
        );
    }
}
