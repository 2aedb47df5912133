package com.quill.content.infrastructure.memory;

import com.quill.content.domain.Post;
import com.quill.content.domain.PostPatch;
import com.quill.content.domain.PostStore;
import com.quill.content.domain.WriteResult;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link PostStore} held in process memory.
 * <p>
 * Mutations run inside {@link ConcurrentMap#compute}, so the existence check, the ownership
 * check and the write happen under the map's per-key lock.
 */
public class InMemoryPostStore implements PostStore {

    static final Comparator<Post> NEWEST_FIRST =
            Comparator.comparing(Post::createdAt).thenComparing(Post::id).reversed();

    private final ConcurrentMap<UUID, Post> posts = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryPostStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Post create(UUID ownerId, String title, String body) {
        Instant now = now();
        Post post = new Post(UUID.randomUUID(), ownerId, title, body, now, now);
        posts.put(post.id(), post);
        return post;
    }

    @Override
    public List<Post> findAll() {
        return posts.values().stream().sorted(NEWEST_FIRST).toList();
    }

    @Override
    public Optional<Post> findById(UUID id) {
        return Optional.ofNullable(posts.get(id));
    }

    @Override
    public List<Post> findByOwner(UUID ownerId) {
        return posts.values().stream()
                .filter(post -> post.isOwnedBy(ownerId))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public WriteResult<Post> update(UUID id, UUID callerId, PostPatch patch) {
        AtomicReference<WriteResult<Post>> result = new AtomicReference<>(WriteResult.notFound());
        posts.computeIfPresent(id, (key, post) -> {
            if (!post.isOwnedBy(callerId)) {
                result.set(WriteResult.forbidden());
                return post;
            }
            Post updated = patch.isEmpty() ? post : patch.applyTo(post, now());
            result.set(WriteResult.ok(updated));
            return updated;
        });
        return result.get();
    }

    @Override
    public WriteResult<Void> delete(UUID id, UUID callerId) {
        AtomicReference<WriteResult<Void>> result = new AtomicReference<>(WriteResult.notFound());
        posts.computeIfPresent(id, (key, post) -> {
            if (!post.isOwnedBy(callerId)) {
                result.set(WriteResult.forbidden());
                return post;
            }
            result.set(WriteResult.ok(null));
            return null;
        });
        return result.get();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
