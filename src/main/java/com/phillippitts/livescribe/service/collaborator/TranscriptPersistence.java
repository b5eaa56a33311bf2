package com.phillippitts.livescribe.service.collaborator;

import com.phillippitts.livescribe.exception.PersistenceException;

/**
 * Stores the final transcript of a finished session.
 */
public interface TranscriptPersistence {

    /**
     * @param sessionId  session id
     * @param transcript joined final transcript (never empty)
     * @throws PersistenceException if the transcript could not be stored
     */
    void persist(String sessionId, String transcript);

    /**
     * Variant carrying the provider's transcription id. Implementations that do not record it
     * fall back to {@link #persist(String, String)}.
     *
     * @param transcriptionId provider request id (may be null)
     */
    default void persist(String sessionId, String transcript, String transcriptionId) {
        persist(sessionId, transcript);
    }
}
