package com.phillippitts.livescribe.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable unit of recognizer output for one session.
 *
 * <p>Interim fragments ({@code isFinal == false}) are broadcast but never persisted; final
 * fragments are also appended to the session's transcript buffer. {@code sequence} is assigned
 * by the recognition adapter and increases monotonically per upstream stream.
 *
 * @param sessionId  owning session
 * @param text       recognized text (must not be null; the adapter drops empty results)
 * @param isFinal    whether the recognizer will revise this text
 * @param confidence confidence score between 0.0 and 1.0
 * @param sequence   per-stream emission counter, starting at 1
 * @param words      word-level timings (empty when not provided)
 */
public record TranscriptFragment(
        String sessionId,
        String text,
        boolean isFinal,
        double confidence,
        long sequence,
        List<TranscriptWord> words
) {

    /**
     * Compact constructor with validation.
     *
     * @throws NullPointerException if sessionId or text is null
     * @throws IllegalArgumentException if confidence is out of range or sequence is not positive
     */
    public TranscriptFragment {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive, got: " + sequence);
        }
        words = words == null ? List.of() : List.copyOf(words);
    }

    public static TranscriptFragment interim(String sessionId, String text, double confidence, long sequence) {
        return new TranscriptFragment(sessionId, text, false, confidence, sequence, List.of());
    }

    public static TranscriptFragment finalFragment(String sessionId, String text, double confidence, long sequence) {
        return new TranscriptFragment(sessionId, text, true, confidence, sequence, List.of());
    }

    /**
     * Speaker of the first diarized word, if any.
     *
     * @return speaker index or {@code null}
     */
    public Integer speaker() {
        for (TranscriptWord w : words) {
            if (w.speaker() != null) {
                return w.speaker();
            }
        }
        return null;
    }
}
