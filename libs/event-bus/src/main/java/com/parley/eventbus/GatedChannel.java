package com.parley.eventbus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A channel that withholds delivery until a one-time {@link AuthCheck} grants it.
 *
 * <p>Wraps a suspended {@link BufferedChannel}. The check runs once, on {@link #start()}, and its
 * outcome is memoized. On approval the inner channel resumes and buffered events drain in order.
 * On denial, failure or timeout the inner channel fails with exactly one terminal error and is
 * removed from its topic; no data event reaches the sink. Closing while the check is pending
 * discards the eventual decision.
 *
 * @param <E> event type
 */
public final class GatedChannel<E> implements Channel<E> {

    private static final Logger log = LoggerFactory.getLogger(GatedChannel.class);

    private final BufferedChannel<E> inner;
    private final AuthCheck check;
    private final Duration timeout;
    private final GatePolicy policy;
    private final AtomicReference<SubscriptionState> state = new AtomicReference<>(SubscriptionState.CREATED);
    private final CompletableFuture<SubscriptionState> authorization = new CompletableFuture<>();
    private final AtomicLong droppedWhilePending = new AtomicLong();

    GatedChannel(BufferedChannel<E> inner, AuthCheck check, Duration timeout, GatePolicy policy) {
        this.inner = inner;
        this.check = check;
        this.timeout = timeout;
        this.policy = policy;
        inner.whenClosed(this::onInnerClosed);
    }

    /**
     * Starts the authorization check. Only the first call has an effect.
     *
     * @return the memoized outcome: completes with {@link SubscriptionState#ACTIVE} on approval,
     *         exceptionally with the denial cause on denial, or with
     *         {@link SubscriptionClosedException} if the channel closes first
     */
    public CompletableFuture<SubscriptionState> start() {
        if (!state.compareAndSet(SubscriptionState.CREATED, SubscriptionState.AWAITING_AUTH)) {
            return authorization;
        }
        CompletableFuture<AuthDecision> decision;
        try {
            decision = check.evaluate();
            if (decision == null) {
                decision = CompletableFuture.failedFuture(
                        new IllegalStateException("Authorization check returned no decision"));
            }
        } catch (RuntimeException e) {
            decision = CompletableFuture.failedFuture(e);
        }
        decision.copy()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete(this::resolve);
        return authorization;
    }

    /** The memoized authorization outcome; see {@link #start()}. */
    public CompletableFuture<SubscriptionState> authorization() {
        return authorization;
    }

    public SubscriptionState state() {
        return state.get();
    }

    /** Events discarded under {@link GatePolicy#DROP} while authorization was pending. */
    public long droppedWhilePending() {
        return droppedWhilePending.get();
    }

    @Override
    public String id() {
        return inner.id();
    }

    @Override
    public String topic() {
        return inner.topic();
    }

    @Override
    public boolean offer(E event) {
        switch (state.get()) {
            case ACTIVE:
                return inner.offer(event);
            case CREATED:
            case AWAITING_AUTH:
                if (policy == GatePolicy.BUFFER) {
                    return inner.offer(event);
                }
                droppedWhilePending.incrementAndGet();
                return true;
            default:
                return false;
        }
    }

    @Override
    public void close() {
        inner.close();
    }

    @Override
    public void fail(Throwable cause) {
        inner.fail(cause);
    }

    @Override
    public boolean isOpen() {
        return inner.isOpen();
    }

    @Override
    public void whenClosed(Runnable hook) {
        inner.whenClosed(hook);
    }

    private void resolve(AuthDecision decision, Throwable error) {
        if (error != null) {
            deny(toDenial(unwrap(error)));
        } else if (decision.granted()) {
            approve();
        } else {
            deny(decision.denial());
        }
    }

    private void approve() {
        if (!state.compareAndSet(SubscriptionState.AWAITING_AUTH, SubscriptionState.ACTIVE)) {
            log.debug("Discarding approval for channel {}; state is {}", id(), state.get());
            return;
        }
        log.debug("Channel {} on topic {} authorized", id(), topic());
        inner.resume();
        authorization.complete(SubscriptionState.ACTIVE);
    }

    private void deny(Throwable cause) {
        if (!state.compareAndSet(SubscriptionState.AWAITING_AUTH, SubscriptionState.DENIED)) {
            log.debug("Discarding denial for channel {}; state is {}", id(), state.get());
            return;
        }
        log.info("Channel {} on topic {} denied: {}", id(), topic(), cause.getMessage());
        authorization.completeExceptionally(cause);
        inner.fail(cause);
    }

    private void onInnerClosed() {
        while (true) {
            SubscriptionState current = state.get();
            if (current == SubscriptionState.DENIED || current == SubscriptionState.CLOSED) {
                return;
            }
            if (state.compareAndSet(current, SubscriptionState.CLOSED)) {
                authorization.completeExceptionally(new SubscriptionClosedException(id()));
                return;
            }
        }
    }

    private Throwable toDenial(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return new AuthorizationTimeoutException(timeout);
        }
        return cause;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
