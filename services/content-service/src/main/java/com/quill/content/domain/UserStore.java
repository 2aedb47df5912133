package com.quill.content.domain;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Credential store: users keyed by id and by normalized email.
 * <p>
 * Implementations must make email uniqueness atomic: of two concurrent creates (or a create and
 * an update) claiming the same email, exactly one wins and the other gets
 * {@link WriteResult.Status#CONFLICT}.
 */
public interface UserStore {

    /**
     * Creates a user with a fresh id.
     *
     * @return {@code OK} with the stored user, or {@code CONFLICT} if the email is taken
     */
    WriteResult<User> create(NewUser newUser);

    Optional<User> findById(UUID id);

    /** Looks a user up by email; the argument is normalized first. */
    Optional<User> findByEmail(String email);

    /** Bulk lookup; ids without a user are skipped. */
    List<User> findAllById(Collection<UUID> ids);

    /**
     * Applies the present fields of {@code patch}.
     *
     * @return {@code OK} with the updated user, {@code NOT_FOUND}, or {@code CONFLICT} when the
     *     new email belongs to another user
     */
    WriteResult<User> update(UUID id, UserPatch patch);
}
