package com.parley.eventbus.routing;

import com.parley.eventbus.AuthCheck;
import com.parley.security.Identity;

/**
 * Describes one named subscription: where its events come from, who may open it, and which events
 * each subscriber sees.
 *
 * @param <E> type of the events published on {@link #topic()}
 */
public interface SubscriptionDefinition<E> {

    String name();

    String topic();

    Class<E> eventType();

    /**
     * Builds the one-time check for a subscriber. Must not start any work until
     * {@link AuthCheck#evaluate()} is called.
     *
     * @param identity the subscriber, never null
     */
    AuthCheck authCheck(FilterArgs args, Identity identity);

    /**
     * Per-event filter, applied only after authorization has been granted.
     *
     * @param identity the subscriber, never null
     */
    boolean accepts(E event, FilterArgs args, Identity identity);
}
