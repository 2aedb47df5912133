package com.quill.security;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Immutable parameters of the {@link TokenService}.
 *
 * @param secret    HMAC signing secret; at least {@value #MIN_SECRET_BYTES} bytes in UTF-8
 * @param ttl       lifetime of an issued token (defaults to one hour)
 * @param clockSkew grace applied to the expiry check only (defaults to 30 seconds)
 */
public record TokenSettings(String secret, Duration ttl, Duration clockSkew) {

    /** Minimum secret length; HS256 needs a 256-bit key. */
    public static final int MIN_SECRET_BYTES = 32;

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofSeconds(30);

    public TokenSettings {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("token secret must be configured");
        }
        if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "token secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (ttl == null) {
            ttl = DEFAULT_TTL;
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (clockSkew == null) {
            clockSkew = DEFAULT_CLOCK_SKEW;
        }
        if (clockSkew.isNegative()) {
            throw new IllegalArgumentException("clockSkew must not be negative");
        }
    }

    byte[] secretBytes() {
        return secret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "TokenSettings[secret=[REDACTED], ttl=" + ttl + ", clockSkew=" + clockSkew + "]";
    }
}
