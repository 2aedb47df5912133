package com.quill.security;

import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/**
 * One-way, salted password hashing with BCrypt.
 * <p>
 * The cost factor is fixed per instance and comes from configuration. Verification reads the cost
 * and salt from the stored {@link HashRecord}, so raising the configured cost never invalidates
 * existing credentials; {@link #needsRehash(HashRecord)} tells callers when a record should be
 * upgraded.
 * <p>
 * BCrypt reads only the first {@value #MAX_PASSWORD_BYTES} bytes of its input. Longer passwords
 * are refused by {@link #hash(String)} and never verify, so two passwords sharing a prefix of that
 * length cannot stand in for each other.
 * <p>
 * Plaintext passwords are never logged or retained.
 */
public final class PasswordHasher {

    /** Lowest cost BCrypt accepts. */
    public static final int MIN_STRENGTH = 4;

    /** Highest cost BCrypt accepts. */
    public static final int MAX_STRENGTH = 31;

    /** Longest password, in UTF-8 bytes, that BCrypt hashes in full. */
    public static final int MAX_PASSWORD_BYTES = 72;

    private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);

    private final BCryptPasswordEncoder encoder;
    private final int strength;

    /**
     * @param strength BCrypt log-rounds, between {@value #MIN_STRENGTH} and {@value #MAX_STRENGTH}
     */
    public PasswordHasher(int strength) {
        if (strength < MIN_STRENGTH || strength > MAX_STRENGTH) {
            throw new IllegalArgumentException(
                    "strength must be between %d and %d but was %d"
                            .formatted(MIN_STRENGTH, MAX_STRENGTH, strength));
        }
        this.strength = strength;
        this.encoder = new BCryptPasswordEncoder(strength);
    }

    /**
     * Hashes a plaintext password with a fresh random salt.
     *
     * @param plaintext the password (must not be null)
     * @return the encoded record
     * @throws IllegalArgumentException if the password is null or longer than
     *     {@value #MAX_PASSWORD_BYTES} UTF-8 bytes
     */
    public HashRecord hash(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        if (!withinLength(plaintext)) {
            throw new IllegalArgumentException(
                    "password must be at most " + MAX_PASSWORD_BYTES + " bytes");
        }
        return new HashRecord(encoder.encode(plaintext));
    }

    /**
     * Checks a plaintext password against a stored record in constant time.
     * <p>
     * Never throws: null arguments, over-long passwords, malformed records and mismatches all
     * return {@code false}.
     *
     * @param plaintext the candidate password
     * @param record    the stored credential
     * @return true only when the password matches
     */
    public boolean verify(String plaintext, HashRecord record) {
        if (plaintext == null || record == null || !withinLength(plaintext)) {
            return false;
        }
        try {
            return encoder.matches(plaintext, record.encoded());
        } catch (IllegalArgumentException e) {
            log.warn("Stored credential could not be verified: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Returns true when {@code plaintext} fits in {@value #MAX_PASSWORD_BYTES} UTF-8 bytes.
     */
    public static boolean withinLength(String plaintext) {
        return plaintext.getBytes(StandardCharsets.UTF_8).length <= MAX_PASSWORD_BYTES;
    }

    /**
     * Returns true when the record was hashed with a lower cost than this hasher's.
     */
    public boolean needsRehash(HashRecord record) {
        int recordCost = record.cost();
        return recordCost >= 0 && recordCost < strength;
    }

    /** The configured cost factor. */
    public int strength() {
        return strength;
    }
}
