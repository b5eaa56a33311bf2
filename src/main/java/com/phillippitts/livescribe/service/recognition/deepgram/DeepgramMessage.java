package com.phillippitts.livescribe.service.recognition.deepgram;

import com.phillippitts.livescribe.domain.TranscriptWord;
import com.phillippitts.livescribe.exception.UpstreamErrorKind;

import java.util.List;

/**
 * One parsed message from the Deepgram live endpoint.
 *
 * @param type       message category
 * @param text       transcript of the first alternative ({@link Type#RESULTS} only, may be empty)
 * @param isFinal    whether the result is final ({@link Type#RESULTS} only)
 * @param confidence clamped confidence of the first alternative
 * @param words      word timings of the first alternative
 * @param requestId  provider request id ({@link Type#METADATA} only)
 * @param error      provider error description ({@link Type#ERROR} only)
 * @param errorKind  classified provider error ({@link Type#ERROR} only)
 */
record DeepgramMessage(
        Type type,
        String text,
        boolean isFinal,
        double confidence,
        List<TranscriptWord> words,
        String requestId,
        String error,
        UpstreamErrorKind errorKind
) {

    enum Type {
        RESULTS,
        METADATA,
        ERROR,
        /** SpeechStarted, UtteranceEnd and anything newer; ignored. */
        OTHER
    }

    static DeepgramMessage results(String text, boolean isFinal, double confidence, List<TranscriptWord> words) {
        return new DeepgramMessage(Type.RESULTS, text, isFinal, confidence, words, null, null, null);
    }

    static DeepgramMessage metadata(String requestId) {
        return new DeepgramMessage(Type.METADATA, "", false, 0.0, List.of(), requestId, null, null);
    }

    static DeepgramMessage error(String error, UpstreamErrorKind errorKind) {
        return new DeepgramMessage(Type.ERROR, "", false, 0.0, List.of(), null, error, errorKind);
    }

    static DeepgramMessage other() {
        return new DeepgramMessage(Type.OTHER, "", false, 0.0, List.of(), null, null, null);
    }
}
