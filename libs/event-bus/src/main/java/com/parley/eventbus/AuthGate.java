package com.parley.eventbus;

import java.time.Duration;

/**
 * Wraps subscription channels with a one-time authorization check.
 * <p>
 * The gate itself is stateless; each {@link GatedChannel} it produces carries its own decision.
 * Call {@link GatedChannel#start()} after registering the channel on its topic so that events
 * published while the check runs are handled according to the {@link GatePolicy}.
 */
public final class AuthGate {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final Duration timeout;
    private final GatePolicy policy;

    public AuthGate() {
        this(DEFAULT_TIMEOUT, GatePolicy.BUFFER);
    }

    public AuthGate(Duration timeout, GatePolicy policy) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        this.timeout = timeout;
        this.policy = policy;
    }

    /**
     * Gates {@code channel} behind {@code check}.
     *
     * @param channel a channel created suspended and not yet resumed
     * @throws IllegalArgumentException if the channel is not suspended or already closed
     */
    public <E> GatedChannel<E> gate(BufferedChannel<E> channel, AuthCheck check) {
        if (channel == null) {
            throw new IllegalArgumentException("channel must not be null");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        if (!channel.isOpen() || !channel.isSuspended()) {
            throw new IllegalArgumentException("channel " + channel.id() + " must be open and suspended");
        }
        return new GatedChannel<>(channel, check, timeout, policy);
    }

    public Duration timeout() {
        return timeout;
    }

    public GatePolicy policy() {
        return policy;
    }
}
