package com.quill.content.domain;

/**
 * An expected, client-caused failure. The message is safe to return to the caller.
 */
public class ContentException extends RuntimeException {

    private final ErrorKind kind;

    public ContentException(ErrorKind kind, String message) {
        super(message);
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        this.kind = kind;
    }

    public static ContentException conflict(String message) {
        return new ContentException(ErrorKind.CONFLICT, message);
    }

    public static ContentException notFound(String message) {
        return new ContentException(ErrorKind.NOT_FOUND, message);
    }

    public static ContentException unauthenticated(String message) {
        return new ContentException(ErrorKind.UNAUTHENTICATED, message);
    }

    public static ContentException forbidden(String message) {
        return new ContentException(ErrorKind.FORBIDDEN, message);
    }

    public static ContentException invalidInput(String message) {
        return new ContentException(ErrorKind.INVALID_INPUT, message);
    }

    public ErrorKind kind() {
        return kind;
    }
}
