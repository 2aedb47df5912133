package com.quill.content.api;

import com.quill.content.domain.User;
import java.time.Instant;
import java.util.UUID;

/**
 * Public view of a user. The password hash is never part of it.
 */
public record UserResponse(UUID id, String name, String email, Instant createdAt, Instant updatedAt) {

    static UserResponse from(User user) {
        return new UserResponse(
                user.id(), user.name(), user.email(), user.createdAt(), user.updatedAt());
    }
}
