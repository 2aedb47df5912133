package com.quill.content.domain;

import com.quill.security.HashRecord;

/**
 * Registration data handed to {@link UserStore#create(NewUser)}. The store assigns id and
 * timestamps.
 */
public record NewUser(String name, String email, HashRecord passwordHash) {

    public NewUser {
        if (name == null || email == null || passwordHash == null) {
            throw new IllegalArgumentException("name, email and passwordHash are required");
        }
        email = User.normalizeEmail(email);
    }
}
