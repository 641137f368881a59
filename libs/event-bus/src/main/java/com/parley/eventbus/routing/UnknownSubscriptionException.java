package com.parley.eventbus.routing;

/**
 * Thrown when a subscription name has no registered {@link SubscriptionDefinition}.
 */
public class UnknownSubscriptionException extends RuntimeException {

    private final String name;

    public UnknownSubscriptionException(String name) {
        super("Unknown subscription: " + name);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
