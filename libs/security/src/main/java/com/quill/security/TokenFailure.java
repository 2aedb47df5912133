package com.quill.security;

/**
 * Why a token was rejected. For logs and metrics only; callers outside the service must see a
 * single "unauthenticated" outcome whatever the reason.
 */
public enum TokenFailure {
    /** Not a well-formed signed token, unsupported algorithm, or required claims missing. */
    MALFORMED,
    /** Signature does not verify with the process secret. */
    BAD_SIGNATURE,
    /** Expiry (plus clock-skew grace) is in the past. */
    EXPIRED
}
