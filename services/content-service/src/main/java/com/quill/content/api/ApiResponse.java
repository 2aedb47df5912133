package com.quill.content.api;

/**
 * Success envelope for every API response: {@code {"message": ..., "data": ...}}.
 *
 * @param message short human-readable outcome
 * @param data    payload, null for operations that return nothing
 * @param <T>     payload type
 */
public record ApiResponse<T>(String message, T data) {

    public static <T> ApiResponse<T> of(String message, T data) {
        return new ApiResponse<>(message, data);
    }

    public static ApiResponse<Void> message(String message) {
        return new ApiResponse<>(message, null);
    }
}
