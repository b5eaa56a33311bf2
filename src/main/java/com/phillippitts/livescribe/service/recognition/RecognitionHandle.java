package com.phillippitts.livescribe.service.recognition;

import java.util.Optional;

/**
 * Opaque handle to one upstream recognition stream, issued by {@link RecognitionClient#open}.
 *
 * <p>A handle belongs to exactly one session and to the client that issued it. Passing it to a
 * different client is a programming error.
 */
public interface RecognitionHandle {

    String sessionId();

    /**
     * @return {@code false} once {@link RecognitionClient#close} or {@link RecognitionClient#abort}
     *         was called or the upstream ended
     */
    boolean isOpen();

    /**
     * Provider-assigned id of the transcription, when the provider reported one.
     */
    Optional<String> transcriptionId();
}
