package com.parley.eventbus.routing;

import com.parley.security.Identity;

/**
 * A request to open a named subscription.
 *
 * @param name     subscription name, e.g. {@code messageAdded}
 * @param args     typed filter arguments
 * @param identity the caller, or {@code null} when unauthenticated
 */
public record SubscriptionRequest(String name, FilterArgs args, Identity identity) {

    public SubscriptionRequest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (args == null) {
            args = FilterArgs.none();
        }
    }
}
