package com.quill.content.domain;

/**
 * Outcome of a store write. Expected failures are values, not exceptions.
 *
 * @param status what happened
 * @param value  the written entity when {@code status} is {@link Status#OK} (may be null for
 *               deletes), otherwise null
 * @param <T>    entity type
 */
public record WriteResult<T>(Status status, T value) {

    public enum Status {
        OK,
        /** A uniqueness rule rejected the write. */
        CONFLICT,
        /** The target does not exist. */
        NOT_FOUND,
        /** The target exists but belongs to someone else. */
        FORBIDDEN
    }

    public WriteResult {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (status != Status.OK && value != null) {
            throw new IllegalArgumentException("only OK results carry a value");
        }
    }

    public static <T> WriteResult<T> ok(T value) {
        return new WriteResult<>(Status.OK, value);
    }

    public static <T> WriteResult<T> conflict() {
        return new WriteResult<>(Status.CONFLICT, null);
    }

    public static <T> WriteResult<T> notFound() {
        return new WriteResult<>(Status.NOT_FOUND, null);
    }

    public static <T> WriteResult<T> forbidden() {
        return new WriteResult<>(Status.FORBIDDEN, null);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
