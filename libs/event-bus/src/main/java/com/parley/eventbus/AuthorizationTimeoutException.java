package com.parley.eventbus;

import java.time.Duration;

/**
 * Terminal error for a subscription whose authorization check did not finish in time.
 */
public class AuthorizationTimeoutException extends RuntimeException {

    private final Duration timeout;

    public AuthorizationTimeoutException(Duration timeout) {
        super("Authorization did not complete within " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
