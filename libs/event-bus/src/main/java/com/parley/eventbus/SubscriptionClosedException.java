package com.parley.eventbus;

/**
 * Completes a pending authorization future when the subscription is closed before the decision
 * arrives. Informational: it is never thrown to a publisher.
 */
public class SubscriptionClosedException extends RuntimeException {

    private final String subscriptionId;

    public SubscriptionClosedException(String subscriptionId) {
        super("Subscription " + subscriptionId + " was closed");
        this.subscriptionId = subscriptionId;
    }

    public String subscriptionId() {
        return subscriptionId;
    }
}
