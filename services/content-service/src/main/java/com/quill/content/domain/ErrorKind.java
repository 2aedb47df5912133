package com.quill.content.domain;

/**
 * Client-visible error categories. Each maps to one HTTP status and one {@code error} label in
 * problem responses.
 */
public enum ErrorKind {
    CONFLICT(409, "Conflict"),
    NOT_FOUND(404, "NotFound"),
    UNAUTHENTICATED(401, "Unauthenticated"),
    FORBIDDEN(403, "Forbidden"),
    INVALID_INPUT(400, "InvalidInput");

    private final int httpStatus;
    private final String label;

    ErrorKind(int httpStatus, String label) {
        this.httpStatus = httpStatus;
        this.label = label;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /** Value of the {@code error} property in problem responses. */
    public String label() {
        return label;
    }
}
