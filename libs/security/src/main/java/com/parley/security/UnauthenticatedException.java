package com.parley.security;

/**
 * Thrown when an operation that requires an {@link Identity} is attempted without one.
 * <p>
 * Terminal: retrying the same request without credentials cannot succeed.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException() {
        super("Unauthenticated");
    }

    public UnauthenticatedException(String message) {
        super(message);
    }
}
