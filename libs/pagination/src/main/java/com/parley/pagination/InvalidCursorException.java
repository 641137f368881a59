package com.parley.pagination;

/**
 * Thrown when a pagination cursor is not one {@link CursorCodec#encode(long)} could have produced.
 * <p>
 * Raised before any store access and never retried: the client must restart pagination from a
 * fresh page.
 */
public class InvalidCursorException extends RuntimeException {

    private final String cursor;

    public InvalidCursorException(String cursor, String reason) {
        super("Invalid cursor '%s': %s".formatted(cursor, reason));
        this.cursor = cursor;
    }

    public InvalidCursorException(String cursor, String reason, Throwable cause) {
        super("Invalid cursor '%s': %s".formatted(cursor, reason), cause);
        this.cursor = cursor;
    }

    /** The rejected cursor as supplied by the client. */
    public String cursor() {
        return cursor;
    }
}
