package com.quill.content.domain;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resource store for posts with ownership enforced on every mutation.
 * <p>
 * {@link #update} and {@link #delete} decide existence first, then ownership, then apply the
 * change, as one atomic step per post. Listings are newest first.
 */
public interface PostStore {

    /** Stores a new post owned by {@code ownerId}. */
    Post create(UUID ownerId, String title, String body);

    List<Post> findAll();

    Optional<Post> findById(UUID id);

    List<Post> findByOwner(UUID ownerId);

    /**
     * An empty patch leaves the post, {@code updatedAt} included, as it is.
     *
     * @return {@code OK} with the updated post, {@code NOT_FOUND}, or {@code FORBIDDEN} when
     *     {@code callerId} is not the owner
     */
    WriteResult<Post> update(UUID id, UUID callerId, PostPatch patch);

    /**
     * @return {@code OK} (no value), {@code NOT_FOUND}, or {@code FORBIDDEN}
     */
    WriteResult<Void> delete(UUID id, UUID callerId);
}
