package com.quill.security;

import java.util.UUID;

/**
 * Compares the caller of a request against the owner recorded on a resource.
 * <p>
 * This is authorization only: the caller has already been authenticated, and existence of the
 * resource must be established before asking who owns it.
 */
public final class OwnershipEnforcer {

    private OwnershipEnforcer() {
        // utility class
    }

    /**
     * Returns true when the caller owns the resource.
     *
     * @param caller  the authenticated caller
     * @param ownerId the owner recorded on the resource
     */
    public static boolean isOwner(CallerIdentity caller, UUID ownerId) {
        return caller != null && ownerId != null && caller.is(ownerId);
    }

    /**
     * Verifies that the caller owns the resource.
     *
     * @param caller  the authenticated caller
     * @param ownerId the owner recorded on the resource
     * @throws OwnershipViolationException if the caller is not the owner
     */
    public static void enforce(CallerIdentity caller, UUID ownerId) {
        if (!isOwner(caller, ownerId)) {
            throw new OwnershipViolationException(caller == null ? null : caller.userId(), ownerId);
        }
    }
}
