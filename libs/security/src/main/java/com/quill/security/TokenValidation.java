package com.quill.security;

import java.util.Optional;
import java.util.UUID;

/**
 * Result of {@link TokenService#validate(String)}: either a subject or a failure reason.
 *
 * @param subject the authenticated user id (null when invalid)
 * @param failure the rejection reason (null when valid)
 */
public record TokenValidation(UUID subject, TokenFailure failure) {

    public TokenValidation {
        if ((subject == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of subject and failure must be set");
        }
    }

    /** Creates a passing result. */
    public static TokenValidation valid(UUID subject) {
        return new TokenValidation(subject, null);
    }

    /** Creates a failing result. */
    public static TokenValidation invalid(TokenFailure failure) {
        return new TokenValidation(null, failure);
    }

    public boolean isValid() {
        return subject != null;
    }

    /** The caller identity for a valid token, empty otherwise. */
    public Optional<CallerIdentity> identity() {
        return isValid() ? Optional.of(new CallerIdentity(subject)) : Optional.empty();
    }
}
