package com.quill.content.api;

import com.quill.security.PasswordHasher;

/**
 * Shared Bean Validation patterns and messages for request bodies.
 * <p>
 * {@code @Pattern} and {@code @Size} accept null, so update requests reuse the same constraints
 * and simply omit {@code @NotNull}.
 */
final class InputRules {

    static final String EMAIL = "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$";
    static final String EMAIL_MESSAGE = "must be a valid email address";

    static final String PASSWORD = "^(?=.*[a-z])(?=.*[A-Z])(?=.*\\d).{8,}$";
    static final String PASSWORD_MESSAGE =
            "must be at least 8 characters with upper-case, lower-case and a digit";

    /** BCrypt input limit; multi-byte characters count once per UTF-8 byte. */
    static final int PASSWORD_MAX_BYTES = PasswordHasher.MAX_PASSWORD_BYTES;

    /** At least one non-whitespace character. */
    static final String NOT_BLANK = "(?s).*\\S.*";
    static final String NOT_BLANK_MESSAGE = "must not be blank";

    static final int NAME_MAX = 100;
    static final int EMAIL_MAX = 255;
    static final int TITLE_MAX = 200;
    static final int BODY_MAX = 20_000;

    private InputRules() {
        // utility class
    }
}
