package com.quill.content.application;

import com.quill.content.domain.Post;
import com.quill.content.domain.User;

/**
 * A post with its author as currently stored. {@code author} is null only if the owning user
 * record is gone.
 */
public record AuthoredPost(Post post, User author) {}
