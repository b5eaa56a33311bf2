package com.phillippitts.livescribe.domain;

import java.util.Objects;

/**
 * Word-level timing emitted by the recognizer alongside a fragment.
 *
 * @param word       recognized word (punctuated form when the provider supplies one)
 * @param startSec   start offset in seconds from the beginning of the stream
 * @param endSec     end offset in seconds
 * @param confidence word confidence between 0.0 and 1.0
 * @param speaker    diarization speaker index, or {@code null} when diarization is off
 */
public record TranscriptWord(
        String word,
        double startSec,
        double endSec,
        double confidence,
        Integer speaker
) {
    public TranscriptWord {
        Objects.requireNonNull(word, "word must not be null");
    }
}
