package com.quill.content.domain;

import com.quill.security.HashRecord;
import java.time.Instant;

/**
 * Partial update of a user. A {@code null} field is left unchanged.
 */
public record UserPatch(String name, String email, HashRecord passwordHash) {

    public UserPatch {
        email = User.normalizeEmail(email);
    }

    public static UserPatch password(HashRecord passwordHash) {
        return new UserPatch(null, null, passwordHash);
    }

    public boolean isEmpty() {
        return name == null && email == null && passwordHash == null;
    }

    /** Applies the present fields to {@code user}. */
    public User applyTo(User user, Instant now) {
        return new User(
                user.id(),
                name != null ? name : user.name(),
                email != null ? email : user.email(),
                passwordHash != null ? passwordHash : user.passwordHash(),
                user.createdAt(),
                now);
    }
}
