package com.phillippitts.livescribe.service.collaborator;

import com.phillippitts.livescribe.domain.Identity;
import com.phillippitts.livescribe.exception.InvalidTokenException;

/**
 * Verifies the bearer token presented when a streaming connection is opened.
 */
@FunctionalInterface
public interface IdentityVerifier {

    /**
     * @param token raw token (may be null)
     * @return the authenticated identity
     * @throws InvalidTokenException if the token is missing, malformed, expired or not signed by
     *                               the trusted issuer
     */
    Identity verify(String token);
}
