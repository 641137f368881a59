package com.parley.eventbus;

/**
 * Lifecycle of a gated subscription.
 * <p>
 * {@code CREATED -> AWAITING_AUTH -> ACTIVE | DENIED}; {@code ACTIVE -> CLOSED}. A subscription
 * closed while still awaiting its decision also ends in {@code CLOSED}. {@code DENIED} is terminal.
 */
public enum SubscriptionState {
    CREATED,
    AWAITING_AUTH,
    ACTIVE,
    DENIED,
    CLOSED;

    public boolean isTerminal() {
        return this == DENIED || this == CLOSED;
    }
}
