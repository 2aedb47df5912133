package com.quill.content.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * A post and the user who owns it.
 *
 * @param id        assigned at creation
 * @param ownerId   the creating user; fixed for the life of the post
 * @param title     post title
 * @param body      post body
 * @param createdAt creation time
 * @param updatedAt last modification time
 */
public record Post(
        UUID id, UUID ownerId, String title, String body, Instant createdAt, Instant updatedAt) {

    public boolean isOwnedBy(UUID userId) {
        return ownerId.equals(userId);
    }
}
