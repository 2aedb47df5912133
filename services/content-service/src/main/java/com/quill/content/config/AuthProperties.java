package com.quill.content.config;

import com.quill.security.TokenSettings;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Authentication settings, bound from {@code quill.auth.*}.
 *
 * <pre>
 * quill:
 *   auth:
 *     token-secret: ${QUILL_TOKEN_SECRET}
 *     token-ttl: PT1H
 *     clock-skew: PT30S
 *     bcrypt-strength: 12
 * </pre>
 *
 * <p>The secret has no default. A missing or short secret stops the application at startup.
 *
 * @param tokenSecret    HMAC secret for bearer tokens, at least 32 bytes
 * @param tokenTtl       token lifetime (default one hour)
 * @param clockSkew      grace on the expiry check (default 30 seconds)
 * @param bcryptStrength BCrypt cost factor (default 12)
 */
@ConfigurationProperties(prefix = "quill.auth")
@Validated
public record AuthProperties(
        @NotBlank String tokenSecret,
        Duration tokenTtl,
        Duration clockSkew,
        @Min(4) @Max(31) Integer bcryptStrength) {

    public static final int DEFAULT_BCRYPT_STRENGTH = 12;

    public AuthProperties {
        if (tokenTtl == null) {
            tokenTtl = TokenSettings.DEFAULT_TTL;
        }
        if (clockSkew == null) {
            clockSkew = TokenSettings.DEFAULT_CLOCK_SKEW;
        }
        if (bcryptStrength == null) {
            bcryptStrength = DEFAULT_BCRYPT_STRENGTH;
        }
    }

    /**
     * @throws IllegalArgumentException if the secret is shorter than 32 bytes
     */
    public TokenSettings toTokenSettings() {
        return new TokenSettings(tokenSecret, tokenTtl, clockSkew);
    }

    @Override
    public String toString() {
        return "AuthProperties[tokenSecret=[REDACTED], tokenTtl=" + tokenTtl
                + ", clockSkew=" + clockSkew + ", bcryptStrength=" + bcryptStrength + "]";
    }
}
