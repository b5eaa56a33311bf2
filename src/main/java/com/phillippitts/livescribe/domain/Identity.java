package com.phillippitts.livescribe.domain;

import java.util.Objects;

/**
 * Authenticated caller identity, as established by the identity verifier at connection time.
 *
 * @param userId stable user identifier from the token (never blank)
 */
public record Identity(String userId) {

    public Identity {
        Objects.requireNonNull(userId, "userId must not be null");
        if (userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
    }

    public static Identity of(String userId) {
        return new Identity(userId);
    }
}
