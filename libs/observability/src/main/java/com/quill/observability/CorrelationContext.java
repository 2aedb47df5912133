package com.quill.observability;

/**
 * Immutable correlation context that follows a single request through the service.
 * <p>
 * Every incoming HTTP request establishes a {@code CorrelationContext}. Its values are echoed to
 * the client, copied into the SLF4J MDC so that every log line carries them, and enriched with the
 * caller's user id once the request has been authenticated.
 *
 * @param correlationId unique ID for the business flow (propagated from the client when present)
 * @param requestId     unique ID for this specific request
 * @param userId        authenticated caller (null until the auth gate has accepted a token)
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String userId
) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for request ID.
     */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * MDC key for user ID.
     */
    public static final String MDC_USER_ID = "userId";

    /**
     * Rejects a missing correlation id.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy of this context bound to the given user.
     *
     * @param authenticatedUserId the caller's user id
     * @return a new context with the same correlation and request ids
     */
    public CorrelationContext withUserId(String authenticatedUserId) {
        return new CorrelationContext(correlationId, requestId, authenticatedUserId);
    }
}
