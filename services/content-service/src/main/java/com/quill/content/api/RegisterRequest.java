package com.quill.content.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank @Size(max = InputRules.NAME_MAX) String name,
        @NotNull @Size(max = InputRules.EMAIL_MAX)
                @Pattern(regexp = InputRules.EMAIL, message = InputRules.EMAIL_MESSAGE)
                String email,
        @NotNull @Pattern(regexp = InputRules.PASSWORD, message = InputRules.PASSWORD_MESSAGE)
                @MaxUtf8Bytes(InputRules.PASSWORD_MAX_BYTES)
                String password) {

    @Override
    public String toString() {
        return "RegisterRequest[name=" + name + ", email=" + email + ", password=[REDACTED]]";
    }
}
