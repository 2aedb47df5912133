package com.quill.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;
import javax.crypto.SecretKey;

/**
 * Issues and validates stateless bearer tokens (compact JWS, HS256).
 *
 * <p>A token carries three claims: {@code sub} (user id), {@code iat} and {@code exp}. Nothing is
 * stored server-side; a token stops working only when it expires or when the signing secret is
 * rotated, which invalidates every outstanding token at once.
 *
 * <p>Validation is a pure function of the token string, the secret and the injected {@link Clock}.
 * The configured clock-skew grace is applied to {@code exp} only; {@code iat} is informational and
 * never checked against the clock.
 *
 * <p>Instances are immutable and safe to share across request threads.
 */
public final class TokenService {

    private final SecretKey signingKey;
    private final TokenSettings settings;
    private final Clock clock;
    private final JwtParser parser;

    public TokenService(TokenSettings settings, Clock clock) {
        if (settings == null || clock == null) {
            throw new IllegalArgumentException("settings and clock must not be null");
        }
        this.settings = settings;
        this.clock = clock;
        this.signingKey = Keys.hmacShaKeyFor(settings.secretBytes());
        this.parser =
                Jwts.parserBuilder()
                        .setSigningKey(signingKey)
                        .setClock(() -> Date.from(clock.instant()))
                        .setAllowedClockSkewSeconds(settings.clockSkew().toSeconds())
                        .build();
    }

    /**
     * Mints a token for the given user, valid from now for the configured TTL.
     *
     * @param userId the subject
     * @return the token and its claims
     */
    public IssuedToken issue(UUID userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId must not be null");
        }
        // JWT NumericDate has second precision
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(settings.ttl());
        String value =
                Jwts.builder()
                        .setSubject(userId.toString())
                        .setIssuedAt(Date.from(issuedAt))
                        .setExpiration(Date.from(expiresAt))
                        .signWith(signingKey, SignatureAlgorithm.HS256)
                        .compact();
        return new IssuedToken(value, userId, issuedAt, expiresAt);
    }

    /**
     * Validates a token and returns its subject.
     *
     * <p>Rejects malformed tokens, unsigned or foreign-algorithm tokens, signature mismatches,
     * tokens without {@code exp} or with a non-UUID subject, and expired tokens. Never throws.
     *
     * @param token the compact token string (may be null)
     * @return the subject, or the reason the token was rejected
     */
    public TokenValidation validate(String token) {
        if (token == null || token.isBlank()) {
            return TokenValidation.invalid(TokenFailure.MALFORMED);
        }
        try {
            Claims claims = parser.parseClaimsJws(token).getBody();
            if (claims.getExpiration() == null || claims.getSubject() == null) {
                return TokenValidation.invalid(TokenFailure.MALFORMED);
            }
            return TokenValidation.valid(UUID.fromString(claims.getSubject()));
        } catch (ExpiredJwtException e) {
            return TokenValidation.invalid(TokenFailure.EXPIRED);
        } catch (SecurityException e) {
            return TokenValidation.invalid(TokenFailure.BAD_SIGNATURE);
        } catch (JwtException | IllegalArgumentException e) {
            return TokenValidation.invalid(TokenFailure.MALFORMED);
        }
    }
}
