package com.quill.security;

import java.time.Instant;
import java.util.UUID;

/**
 * A freshly minted bearer token together with the claims it carries.
 *
 * @param value     the compact token string handed to the client
 * @param subject   the user the token authenticates as
 * @param issuedAt  the {@code iat} claim
 * @param expiresAt the {@code exp} claim
 */
public record IssuedToken(String value, UUID subject, Instant issuedAt, Instant expiresAt) {

    @Override
    public String toString() {
        return "IssuedToken[subject=" + subject + ", expiresAt=" + expiresAt + "]";
    }
}
