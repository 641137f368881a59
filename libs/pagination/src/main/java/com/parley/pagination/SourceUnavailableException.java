package com.parley.pagination;

/**
 * Thrown when the backing record store cannot serve a scan or existence check.
 * <p>
 * Transient from the caller's point of view: the same request may succeed on retry. The
 * pagination engine itself never retries.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
