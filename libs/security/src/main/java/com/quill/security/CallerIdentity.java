package com.quill.security;

import java.util.UUID;

/**
 * The authenticated caller of a request, as established from a validated bearer token.
 * <p>
 * Carries the user id only. A token says nothing else about the user, so any profile field must
 * be re-read from the credential store. Instances are created by the auth gate and handed to
 * each protected operation as an explicit argument.
 *
 * @param userId unique user identifier (from the token's {@code sub} claim)
 */
public record CallerIdentity(UUID userId) {

    public CallerIdentity {
        if (userId == null) {
            throw new IllegalArgumentException("userId must not be null");
        }
    }

    /** Returns true when this caller is the given user. */
    public boolean is(UUID otherUserId) {
        return userId.equals(otherUserId);
    }
}
