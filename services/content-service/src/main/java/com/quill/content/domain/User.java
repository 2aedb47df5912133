package com.quill.content.domain;

import com.quill.security.HashRecord;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * A registered user.
 *
 * @param id           assigned at creation, never changes
 * @param name         display name
 * @param email        normalized address, unique across users
 * @param passwordHash stored credential; never leaves the service
 * @param createdAt    creation time
 * @param updatedAt    last modification time
 */
public record User(
        UUID id,
        String name,
        String email,
        HashRecord passwordHash,
        Instant createdAt,
        Instant updatedAt) {

    /**
     * Canonical form of an email address: trimmed and lower-cased. Lookups and the uniqueness
     * check both go through this, so {@code A@X.com} and {@code a@x.com} are the same user.
     */
    public static String normalizeEmail(String email) {
        return email == null ? null : email.strip().toLowerCase(Locale.ROOT);
    }
}
