package com.phillippitts.livescribe.service.collaborator;

import com.phillippitts.livescribe.domain.Identity;
import com.phillippitts.livescribe.exception.SessionNotFoundException;

/**
 * Resolves who owns a session id (a meeting, in the surrounding application).
 */
public interface SessionOwnershipLookup {

    /**
     * @param sessionId session id
     * @return owner identity
     * @throws SessionNotFoundException if the id is unknown to the owning application
     */
    Identity ownerOf(String sessionId);

    /**
     * Whether {@code identity} may listen to the live transcript of {@code sessionId}.
     * Defaults to owner equality.
     *
     * @throws SessionNotFoundException if the id is unknown to the owning application
     */
    default boolean canObserve(String sessionId, Identity identity) {
        return ownerOf(sessionId).equals(identity);
    }
}
