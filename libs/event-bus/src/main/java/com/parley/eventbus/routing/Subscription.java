package com.parley.eventbus.routing;

import com.parley.eventbus.GatedChannel;
import com.parley.eventbus.SubscriptionState;
import com.parley.security.Identity;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on an open subscription. Closing it removes the channel from its topic and completes the
 * subscriber's sink.
 */
public final class Subscription implements AutoCloseable {

    private final String id;
    private final String name;
    private final FilterArgs args;
    private final Identity identity;
    private final GatedChannel<Object> channel;

    Subscription(String id, String name, FilterArgs args, Identity identity, GatedChannel<Object> channel) {
        this.id = id;
        this.name = name;
        this.args = args;
        this.identity = identity;
        this.channel = channel;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String topic() {
        return channel.topic();
    }

    public FilterArgs args() {
        return args;
    }

    public Identity identity() {
        return identity;
    }

    public SubscriptionState state() {
        return channel.state();
    }

    /**
     * Completes with {@link SubscriptionState#ACTIVE} once authorized, or exceptionally with the
     * denial cause.
     */
    public CompletableFuture<SubscriptionState> authorization() {
        return channel.authorization();
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() {
        channel.close();
    }

    @Override
    public String toString() {
        return "Subscription[id=" + id + ", name=" + name + ", state=" + state() + "]";
    }
}
