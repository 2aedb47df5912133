package com.quill.content.api;

import com.quill.content.application.AccountService;
import com.quill.security.CallerIdentity;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Registration, login and the caller's own profile.
 *
 * <p>{@code register} and {@code login} are public. The profile endpoints sit behind the auth
 * gate and receive the caller as a {@link CallerIdentity} argument.
 */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final AccountService accounts;

    public AuthController(AccountService accounts) {
        this.accounts = accounts;
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        var result = accounts.register(request.name(), request.email(), request.password());
        return ApiResponse.of("User registered successfully", AuthResponse.from(result));
    }

    @PostMapping("/login")
    public ApiResponse<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        var result = accounts.login(request.email(), request.password());
        return ApiResponse.of("Login successful", AuthResponse.from(result));
    }

    @GetMapping("/profile")
    public ApiResponse<UserResponse> profile(CallerIdentity caller) {
        return ApiResponse.of("Profile retrieved", UserResponse.from(accounts.profile(caller)));
    }

    @PutMapping("/profile")
    public ApiResponse<UserResponse> updateProfile(
            CallerIdentity caller, @Valid @RequestBody UpdateProfileRequest request) {
        var user = accounts.updateProfile(
                caller, request.name(), request.email(), request.password());
        return ApiResponse.of("Profile updated successfully", UserResponse.from(user));
    }
}
