package com.parley.eventbus.routing;

import com.parley.eventbus.AuthCheck;
import com.parley.eventbus.AuthGate;
import com.parley.eventbus.BufferedChannel;
import com.parley.eventbus.EventSink;
import com.parley.eventbus.GatedChannel;
import com.parley.eventbus.TopicBus;
import com.parley.observability.CorrelationContext;
import com.parley.observability.CorrelationContextHolder;
import com.parley.observability.MetricFactory;
import com.parley.security.Identity;
import com.parley.security.UnauthenticatedException;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Opens named subscriptions on the {@link TopicBus}.
 *
 * <p>For each request the router looks up the {@link SubscriptionDefinition}, creates a suspended
 * channel whose sink is guarded by the definition's per-event filter, gates it behind the
 * definition's one-time {@link AuthCheck}, registers it on the topic and then starts the check.
 * Registering before checking means events published while the check runs are held by the gate
 * rather than missed.
 *
 * <p>A request without an identity is denied with {@link UnauthenticatedException} without
 * consulting the definition.
 */
public final class SubscriptionRouter {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRouter.class);

    private final TopicBus bus;
    private final AuthGate gate;
    private final Map<String, SubscriptionDefinition<?>> definitions;
    private final ConcurrentHashMap<String, Subscription> active = new ConcurrentHashMap<>();
    private final Counter opened;

    public SubscriptionRouter(TopicBus bus, AuthGate gate,
                              Collection<? extends SubscriptionDefinition<?>> definitions,
                              MetricFactory metrics) {
        if (bus == null) {
            throw new IllegalArgumentException("bus must not be null");
        }
        if (gate == null) {
            throw new IllegalArgumentException("gate must not be null");
        }
        if (definitions == null) {
            throw new IllegalArgumentException("definitions must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        Map<String, SubscriptionDefinition<?>> byName = new LinkedHashMap<>();
        for (SubscriptionDefinition<?> definition : definitions) {
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate subscription name: " + definition.name());
            }
        }
        this.bus = bus;
        this.gate = gate;
        this.definitions = Map.copyOf(byName);
        this.opened = metrics.counter("feed.subscriptions.opened", "Subscriptions opened");
        metrics.gauge("feed.subscriptions.active", "Subscriptions currently open", active::size);
    }

    /**
     * Opens a subscription. Returns immediately; authorization completes asynchronously and its
     * outcome is reported through {@link Subscription#authorization()} and, on denial, a terminal
     * error on {@code sink}.
     *
     * @throws UnknownSubscriptionException if no definition has the requested name
     */
    public Subscription subscribe(SubscriptionRequest request, EventSink<Object> sink) {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink must not be null");
        }
        SubscriptionDefinition<?> definition = definitions.get(request.name());
        if (definition == null) {
            throw new UnknownSubscriptionException(request.name());
        }
        return open(definition, request, sink);
    }

    /**
     * Closes the subscription with the given id.
     *
     * @return {@code false} if no such subscription is open
     */
    public boolean unsubscribe(String subscriptionId) {
        Subscription subscription = active.get(subscriptionId);
        if (subscription == null) {
            return false;
        }
        subscription.close();
        return true;
    }

    /**
     * Closes every open subscription matching {@code filter}. Used when the facts an authorization
     * was decided on change, such as a member leaving a group.
     *
     * @return the number of subscriptions closed
     */
    public int closeWhere(Predicate<? super Subscription> filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter must not be null");
        }
        int closed = 0;
        for (Subscription subscription : active.values()) {
            if (filter.test(subscription)) {
                subscription.close();
                closed++;
            }
        }
        if (closed > 0) {
            log.info("Closed {} subscription(s) whose authorization no longer holds", closed);
        }
        return closed;
    }

    public Optional<Subscription> find(String subscriptionId) {
        return Optional.ofNullable(active.get(subscriptionId));
    }

    public int activeSubscriptions() {
        return active.size();
    }

    public Set<String> names() {
        return definitions.keySet();
    }

    private <E> Subscription open(SubscriptionDefinition<E> definition, SubscriptionRequest request,
                                  EventSink<Object> sink) {
        String id = UUID.randomUUID().toString();
        FilterArgs args = request.args();
        Identity identity = request.identity();

        AuthCheck check = identity == null
                ? AuthCheck.denyWith(new UnauthenticatedException())
                : definition.authCheck(args, identity);
        EventSink<Object> filtered = new FilteringSink<>(definition, args, identity, sink);

        BufferedChannel<Object> channel =
                bus.newChannel(definition.topic(), id, filtered, true, deliveryContext(id, identity));
        GatedChannel<Object> gated = gate.gate(channel, check);
        Subscription subscription = new Subscription(id, definition.name(), args, identity, gated);

        active.put(id, subscription);
        gated.whenClosed(() -> {
            active.remove(id);
            log.debug("Subscription {} ({}) closed in state {}", id, definition.name(), gated.state());
        });
        bus.register(definition.topic(), gated);
        opened.increment();
        log.info("Opened subscription {} ({}) on topic {} for user {}",
                id, definition.name(), definition.topic(), identity == null ? "anonymous" : identity.userId());

        gated.start();
        return subscription;
    }

    private static CorrelationContext deliveryContext(String subscriptionId, Identity identity) {
        String userId = identity == null ? null : String.valueOf(identity.userId());
        return CorrelationContextHolder.get()
                .map(ctx -> ctx.withSubscriptionId(subscriptionId))
                .orElseGet(() -> new CorrelationContext(subscriptionId, userId, subscriptionId));
    }
}
