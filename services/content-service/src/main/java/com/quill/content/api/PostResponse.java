package com.quill.content.api;

import com.quill.content.application.AuthoredPost;
import com.quill.content.domain.Post;
import com.quill.content.domain.User;
import java.time.Instant;
import java.util.UUID;

public record PostResponse(
        UUID id,
        String title,
        String body,
        UUID ownerId,
        Author author,
        Instant createdAt,
        Instant updatedAt) {

    /** Author summary, read from the user store at response time. */
    public record Author(UUID id, String name, String email) {

        static Author from(User user) {
            return user == null ? null : new Author(user.id(), user.name(), user.email());
        }
    }

    static PostResponse from(AuthoredPost authored) {
        Post post = authored.post();
        return new PostResponse(
                post.id(),
                post.title(),
                post.body(),
                post.ownerId(),
                Author.from(authored.author()),
                post.createdAt(),
                post.updatedAt());
    }
}
