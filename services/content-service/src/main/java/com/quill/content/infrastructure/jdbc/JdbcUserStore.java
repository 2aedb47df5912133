package com.quill.content.infrastructure.jdbc;

import com.quill.content.domain.NewUser;
import com.quill.content.domain.User;
import com.quill.content.domain.UserPatch;
import com.quill.content.domain.UserStore;
import com.quill.content.domain.WriteResult;
import com.quill.security.HashRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link UserStore} over the {@code users} table.
 * <p>
 * Email uniqueness is enforced by the {@code uq_users_email} constraint; a violation surfaces as
 * {@link DuplicateKeyException} and is reported as {@code CONFLICT}.
 */
public class JdbcUserStore implements UserStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcUserStore.class);

    private static final String COLUMNS = "id, name, email, password_hash, created_at, updated_at";

    private static final RowMapper<User> USER_MAPPER = JdbcUserStore::mapUser;

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcUserStore(JdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public WriteResult<User> create(NewUser newUser) {
        Instant now = now();
        User user = new User(
                UUID.randomUUID(), newUser.name(), newUser.email(), newUser.passwordHash(), now, now);
        try {
            jdbc.update(
                    "INSERT INTO users (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)",
                    user.id().toString(),
                    user.name(),
                    user.email(),
                    user.passwordHash().encoded(),
                    toDb(now),
                    toDb(now));
        } catch (DuplicateKeyException e) {
            log.debug("Email already registered: {}", e.getMessage());
            return WriteResult.conflict();
        }
        return WriteResult.ok(user);
    }

    @Override
    public Optional<User> findById(UUID id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM users WHERE id = ?", USER_MAPPER,
                        id.toString())
                .stream()
                .findFirst();
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return jdbc.query("SELECT " + COLUMNS + " FROM users WHERE email = ?", USER_MAPPER,
                        User.normalizeEmail(email))
                .stream()
                .findFirst();
    }

    @Override
    public List<User> findAllById(Collection<UUID> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(ids.size(), "?"));
        Object[] args = ids.stream().map(UUID::toString).toArray();
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM users WHERE id IN (" + placeholders + ")",
                USER_MAPPER,
                args);
    }

    @Override
    public WriteResult<User> update(UUID id, UserPatch patch) {
        List<String> assignments = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        if (patch.name() != null) {
            assignments.add("name = ?");
            args.add(patch.name());
        }
        if (patch.email() != null) {
            assignments.add("email = ?");
            args.add(patch.email());
        }
        if (patch.passwordHash() != null) {
            assignments.add("password_hash = ?");
            args.add(patch.passwordHash().encoded());
        }
        assignments.add("updated_at = ?");
        args.add(toDb(now()));
        args.add(id.toString());

        int rows;
        try {
            rows = jdbc.update(
                    "UPDATE users SET " + String.join(", ", assignments) + " WHERE id = ?",
                    args.toArray());
        } catch (DuplicateKeyException e) {
            log.debug("Email already registered: {}", e.getMessage());
            return WriteResult.conflict();
        }
        if (rows == 0) {
            return WriteResult.notFound();
        }
        return findById(id).<WriteResult<User>>map(WriteResult::ok).orElseGet(WriteResult::notFound);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    static OffsetDateTime toDb(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    static Instant fromDb(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, OffsetDateTime.class).toInstant();
    }

    private static User mapUser(ResultSet rs, int rowNum) throws SQLException {
        return new User(
                UUID.fromString(rs.getString("id")),
                rs.getString("name"),
                rs.getString("email"),
                new HashRecord(rs.getString("password_hash")),
                fromDb(rs, "created_at"),
                fromDb(rs, "updated_at"));
    }
}
