package com.quill.content.domain;

import java.time.Instant;

/**
 * Partial update of a post. A {@code null} field is left unchanged; the owner can never be
 * patched.
 */
public record PostPatch(String title, String body) {

    public boolean isEmpty() {
        return title == null && body == null;
    }

    /** Applies the present fields to {@code post}. */
    public Post applyTo(Post post, Instant now) {
        return new Post(
                post.id(),
                post.ownerId(),
                title != null ? title : post.title(),
                body != null ? body : post.body(),
                post.createdAt(),
                now);
    }
}
