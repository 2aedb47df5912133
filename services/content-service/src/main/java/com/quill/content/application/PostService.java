package com.quill.content.application;

import com.quill.content.domain.ContentException;
import com.quill.content.domain.Post;
import com.quill.content.domain.PostPatch;
import com.quill.content.domain.PostStore;
import com.quill.content.domain.User;
import com.quill.content.domain.UserStore;
import com.quill.content.domain.WriteResult;
import com.quill.observability.MetricFactory;
import com.quill.security.CallerIdentity;
import com.quill.security.OwnershipEnforcer;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Post operations. Reads are public; writes take the caller explicitly and leave the ownership
 * decision to the store, which makes it atomically with the write.
 */
@Service
public class PostService {

    static final String METRIC_POST_WRITES = "quill.posts.writes";

    static final String POST_NOT_FOUND = "Post not found";

    private static final String METRIC_DESCRIPTION = "Post create, update and delete attempts";

    private static final Logger log = LoggerFactory.getLogger(PostService.class);

    private final PostStore posts;
    private final UserStore users;
    private final MetricFactory metrics;

    public PostService(PostStore posts, UserStore users, MetricFactory metrics) {
        this.posts = posts;
        this.users = users;
        this.metrics = metrics;
    }

    public AuthoredPost create(CallerIdentity caller, String title, String body) {
        User author = users.findById(caller.userId())
                .orElseThrow(() -> ContentException.notFound(AccountService.USER_NOT_FOUND));
        Post post = posts.create(caller.userId(), title, body);
        record("create", "success");
        log.info("Post created: postId={}, ownerId={}", post.id(), post.ownerId());
        return new AuthoredPost(post, author);
    }

    public List<AuthoredPost> list() {
        return withAuthors(posts.findAll());
    }

    public AuthoredPost get(UUID id) {
        Post post = posts.findById(id).orElseThrow(() -> ContentException.notFound(POST_NOT_FOUND));
        return new AuthoredPost(post, users.findById(post.ownerId()).orElse(null));
    }

    /**
     * Lists the posts owned by {@code ownerId}; only the owner may ask.
     *
     * @throws com.quill.security.OwnershipViolationException if the caller is not {@code ownerId}
     */
    public List<AuthoredPost> listByOwner(CallerIdentity caller, UUID ownerId) {
        OwnershipEnforcer.enforce(caller, ownerId);
        return withAuthors(posts.findByOwner(ownerId));
    }

    /**
     * Applies {@code patch} to the caller's own post. An empty patch changes nothing, not even
     * {@code updatedAt}, but still answers {@code NOT_FOUND} and {@code FORBIDDEN} as a real update
     * would.
     */
    public AuthoredPost update(CallerIdentity caller, UUID id, PostPatch patch) {
        WriteResult<Post> result = patch.isEmpty()
                ? unchanged(id, caller)
                : posts.update(id, caller.userId(), patch);
        Post post = unwrap(result, "update", "You can only update your own posts", caller, id);
        log.info("Post updated: postId={}, empty={}", id, patch.isEmpty());
        return new AuthoredPost(post, users.findById(post.ownerId()).orElse(null));
    }

    public void delete(CallerIdentity caller, UUID id) {
        unwrap(posts.delete(id, caller.userId()), "delete", "You can only delete your own posts",
                caller, id);
        log.info("Post deleted: postId={}", id);
    }

    private WriteResult<Post> unchanged(UUID id, CallerIdentity caller) {
        return posts.findById(id)
                .map(post -> post.isOwnedBy(caller.userId())
                        ? WriteResult.ok(post)
                        : WriteResult.<Post>forbidden())
                .orElseGet(WriteResult::notFound);
    }

    private <T> T unwrap(
            WriteResult<T> result, String operation, String forbiddenMessage,
            CallerIdentity caller, UUID id) {
        switch (result.status()) {
            case OK -> {
                record(operation, "success");
                return result.value();
            }
            case FORBIDDEN -> {
                record(operation, "forbidden");
                log.warn("Ownership violation: operation={}, postId={}, callerId={}",
                        operation, id, caller.userId());
                throw ContentException.forbidden(forbiddenMessage);
            }
            default -> {
                record(operation, "not_found");
                throw ContentException.notFound(POST_NOT_FOUND);
            }
        }
    }

    private List<AuthoredPost> withAuthors(List<Post> page) {
        Set<UUID> ownerIds = page.stream().map(Post::ownerId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<UUID, User> authors = users.findAllById(ownerIds).stream()
                .collect(Collectors.toMap(User::id, Function.identity()));
        return page.stream().map(post -> new AuthoredPost(post, authors.get(post.ownerId()))).toList();
    }

    private void record(String operation, String outcome) {
        metrics.recordOutcome(METRIC_POST_WRITES, METRIC_DESCRIPTION, operation, outcome);
    }
}
