package com.quill.content.api;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Profile changes. Absent and null fields are left unchanged.
 */
public record UpdateProfileRequest(
        @Size(max = InputRules.NAME_MAX)
                @Pattern(regexp = InputRules.NOT_BLANK, message = InputRules.NOT_BLANK_MESSAGE)
                String name,
        @Size(max = InputRules.EMAIL_MAX)
                @Pattern(regexp = InputRules.EMAIL, message = InputRules.EMAIL_MESSAGE)
                String email,
        @Pattern(regexp = InputRules.PASSWORD, message = InputRules.PASSWORD_MESSAGE)
                @MaxUtf8Bytes(InputRules.PASSWORD_MAX_BYTES)
                String password) {

    @Override
    public String toString() {
        return "UpdateProfileRequest[name=" + name + ", email=" + email + ", password="
                + (password == null ? "null" : "[REDACTED]") + "]";
    }
}
