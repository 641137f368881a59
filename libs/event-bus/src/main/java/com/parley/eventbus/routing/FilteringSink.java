package com.parley.eventbus.routing;

import com.parley.eventbus.EventSink;
import com.parley.security.Identity;

/** Applies a definition's per-event filter in front of the subscriber's sink. */
final class FilteringSink<E> implements EventSink<Object> {

    private final SubscriptionDefinition<E> definition;
    private final FilterArgs args;
    private final Identity identity;
    private final EventSink<Object> downstream;

    FilteringSink(SubscriptionDefinition<E> definition, FilterArgs args, Identity identity,
                  EventSink<Object> downstream) {
        this.definition = definition;
        this.args = args;
        this.identity = identity;
        this.downstream = downstream;
    }

    @Override
    public void onEvent(Object event) {
        Class<E> type = definition.eventType();
        if (type.isInstance(event) && definition.accepts(type.cast(event), args, identity)) {
            downstream.onEvent(event);
        }
    }

    @Override
    public void onError(Throwable cause) {
        downstream.onError(cause);
    }

    @Override
    public void onComplete() {
        downstream.onComplete();
    }
}
