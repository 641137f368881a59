package com.parley.eventbus;

/**
 * Outcome of an {@link AuthCheck}.
 *
 * @param granted whether the subscriber may receive events
 * @param denial  the error delivered to the subscriber when not granted
 */
public record AuthDecision(boolean granted, RuntimeException denial) {

    private static final AuthDecision GRANTED = new AuthDecision(true, null);

    public AuthDecision {
        if (!granted && denial == null) {
            throw new IllegalArgumentException("a denial must carry an error");
        }
        if (granted && denial != null) {
            throw new IllegalArgumentException("a grant must not carry an error");
        }
    }

    public static AuthDecision grant() {
        return GRANTED;
    }

    public static AuthDecision deny(RuntimeException denial) {
        return new AuthDecision(false, denial);
    }
}
