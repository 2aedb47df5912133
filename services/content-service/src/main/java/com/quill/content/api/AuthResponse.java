package com.quill.content.api;

import com.quill.content.application.AuthResult;
import java.time.Instant;

public record AuthResponse(String token, Instant expiresAt, UserResponse user) {

    static AuthResponse from(AuthResult result) {
        return new AuthResponse(
                result.token().value(), result.token().expiresAt(), UserResponse.from(result.user()));
    }
}
