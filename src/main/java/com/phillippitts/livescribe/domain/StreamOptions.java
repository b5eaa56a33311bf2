package com.phillippitts.livescribe.domain;

/**
 * Optional per-stream audio and model settings supplied by the client with {@code stream:start}.
 * Any {@code null} component means "use the configured default".
 *
 * @param sampleRate audio sample rate in Hz
 * @param encoding   audio encoding name understood by the provider (e.g. {@code linear16})
 * @param channels   number of interleaved audio channels
 * @param language   BCP-47 language tag
 * @param model      provider model name
 */
public record StreamOptions(
        Integer sampleRate,
        String encoding,
        Integer channels,
        String language,
        String model
) {

    private static final StreamOptions NONE = new StreamOptions(null, null, null, null, null);

    public StreamOptions {
        if (sampleRate != null && sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        if (channels != null && channels <= 0) {
            throw new IllegalArgumentException("channels must be positive, got: " + channels);
        }
    }

    public static StreamOptions none() {
        return NONE;
    }
}
