package com.quill.content.infrastructure.jdbc;

import static com.quill.content.infrastructure.jdbc.JdbcUserStore.fromDb;
import static com.quill.content.infrastructure.jdbc.JdbcUserStore.toDb;

import com.quill.content.domain.Post;
import com.quill.content.domain.PostPatch;
import com.quill.content.domain.PostStore;
import com.quill.content.domain.WriteResult;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link PostStore} over the {@code posts} table.
 * <p>
 * Mutations are a single conditional statement ({@code WHERE id = ? AND owner_id = ?}). Only when
 * it touches no row does the store look the post up to tell {@code NOT_FOUND} from
 * {@code FORBIDDEN}; since the owner column never changes, the lookup can only disagree with the
 * failed statement through a concurrent delete, which is reported as {@code NOT_FOUND}.
 */
public class JdbcPostStore implements PostStore {

    private static final String COLUMNS = "id, owner_id, title, body, created_at, updated_at";

    private static final String NEWEST_FIRST = " ORDER BY created_at DESC, id DESC";

    private static final RowMapper<Post> POST_MAPPER = JdbcPostStore::mapPost;

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcPostStore(JdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public Post create(UUID ownerId, String title, String body) {
        Instant now = now();
        Post post = new Post(UUID.randomUUID(), ownerId, title, body, now, now);
        jdbc.update(
                "INSERT INTO posts (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)",
                post.id().toString(),
                ownerId.toString(),
                title,
                body,
                toDb(now),
                toDb(now));
        return post;
    }

    @Override
    public List<Post> findAll() {
        return jdbc.query("SELECT " + COLUMNS + " FROM posts" + NEWEST_FIRST, POST_MAPPER);
    }

    @Override
    public Optional<Post> findById(UUID id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM posts WHERE id = ?", POST_MAPPER,
                        id.toString())
                .stream()
                .findFirst();
    }

    @Override
    public List<Post> findByOwner(UUID ownerId) {
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM posts WHERE owner_id = ?" + NEWEST_FIRST,
                POST_MAPPER,
                ownerId.toString());
    }

    @Override
    public WriteResult<Post> update(UUID id, UUID callerId, PostPatch patch) {
        if (patch.isEmpty()) {
            return findById(id)
                    .map(post -> post.isOwnedBy(callerId)
                            ? WriteResult.ok(post)
                            : WriteResult.<Post>forbidden())
                    .orElseGet(WriteResult::notFound);
        }
        List<String> assignments = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        if (patch.title() != null) {
            assignments.add("title = ?");
            args.add(patch.title());
        }
        if (patch.body() != null) {
            assignments.add("body = ?");
            args.add(patch.body());
        }
        assignments.add("updated_at = ?");
        args.add(toDb(now()));
        args.add(id.toString());
        args.add(callerId.toString());

        int rows = jdbc.update(
                "UPDATE posts SET " + String.join(", ", assignments)
                        + " WHERE id = ? AND owner_id = ?",
                args.toArray());
        if (rows == 0) {
            return missOutcome(id);
        }
        return findById(id).<WriteResult<Post>>map(WriteResult::ok).orElseGet(WriteResult::notFound);
    }

    @Override
    public WriteResult<Void> delete(UUID id, UUID callerId) {
        int rows = jdbc.update(
                "DELETE FROM posts WHERE id = ? AND owner_id = ?",
                id.toString(),
                callerId.toString());
        return rows == 0 ? missOutcome(id) : WriteResult.ok(null);
    }

    private <T> WriteResult<T> missOutcome(UUID id) {
        Integer count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM posts WHERE id = ?", Integer.class, id.toString());
        return count != null && count > 0 ? WriteResult.forbidden() : WriteResult.notFound();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static Post mapPost(ResultSet rs, int rowNum) throws SQLException {
        return new Post(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("owner_id")),
                rs.getString("title"),
                rs.getString("body"),
                fromDb(rs, "created_at"),
                fromDb(rs, "updated_at"));
    }
}
