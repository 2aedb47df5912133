package com.quill.content.infrastructure.memory;

import com.quill.content.domain.NewUser;
import com.quill.content.domain.User;
import com.quill.content.domain.UserPatch;
import com.quill.content.domain.UserStore;
import com.quill.content.domain.WriteResult;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link UserStore} held in process memory.
 * <p>
 * The email index is the uniqueness authority: whoever wins {@code putIfAbsent} on an email owns
 * it. Creates are lock-free; profile updates are serialized among themselves.
 */
public class InMemoryUserStore implements UserStore {

    private final ConcurrentMap<UUID, User> users = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, UUID> emailIndex = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryUserStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public WriteResult<User> create(NewUser newUser) {
        UUID id = UUID.randomUUID();
        if (emailIndex.putIfAbsent(newUser.email(), id) != null) {
            return WriteResult.conflict();
        }
        Instant now = now();
        User user = new User(id, newUser.name(), newUser.email(), newUser.passwordHash(), now, now);
        users.put(id, user);
        return WriteResult.ok(user);
    }

    @Override
    public Optional<User> findById(UUID id) {
        return Optional.ofNullable(users.get(id));
    }

    @Override
    public Optional<User> findByEmail(String email) {
        UUID id = emailIndex.get(User.normalizeEmail(email));
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public List<User> findAllById(Collection<UUID> ids) {
        return ids.stream().map(users::get).filter(Objects::nonNull).toList();
    }

    @Override
    public synchronized WriteResult<User> update(UUID id, UserPatch patch) {
        User current = users.get(id);
        if (current == null) {
            return WriteResult.notFound();
        }
        String newEmail = patch.email();
        boolean emailChanges = newEmail != null && !newEmail.equals(current.email());
        if (emailChanges) {
            UUID holder = emailIndex.putIfAbsent(newEmail, id);
            if (holder != null && !holder.equals(id)) {
                return WriteResult.conflict();
            }
        }
        User updated = patch.applyTo(current, now());
        users.put(id, updated);
        if (emailChanges) {
            emailIndex.remove(current.email(), id);
        }
        return WriteResult.ok(updated);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
