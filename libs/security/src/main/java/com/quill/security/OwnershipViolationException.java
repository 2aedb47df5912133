package com.quill.security;

import java.util.UUID;

/**
 * Thrown when an authenticated caller acts on a resource owned by someone else.
 * <p>
 * The message names both ids and is meant for logs; HTTP responses use a fixed message.
 */
public class OwnershipViolationException extends RuntimeException {

    private final UUID callerId;
    private final UUID ownerId;

    public OwnershipViolationException(UUID callerId, UUID ownerId) {
        super("Ownership violation: caller '%s' cannot act on a resource owned by '%s'"
                .formatted(callerId, ownerId));
        this.callerId = callerId;
        this.ownerId = ownerId;
    }

    public UUID callerId() {
        return callerId;
    }

    public UUID ownerId() {
        return ownerId;
    }
}
