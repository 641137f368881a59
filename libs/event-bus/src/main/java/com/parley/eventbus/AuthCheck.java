package com.parley.eventbus;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * One-time authorization check for a subscription.
 * <p>
 * {@link #evaluate()} is called at most once per subscription. An exceptionally completed future
 * is treated as a denial carrying that exception.
 */
@FunctionalInterface
public interface AuthCheck {

    CompletableFuture<AuthDecision> evaluate();

    /** A check that always grants. */
    static AuthCheck allowAll() {
        return () -> CompletableFuture.completedFuture(AuthDecision.grant());
    }

    /** A check that always denies with the given error. */
    static AuthCheck denyWith(RuntimeException denial) {
        return () -> CompletableFuture.completedFuture(AuthDecision.deny(denial));
    }

    /**
     * Adapts an access check that completes normally when access is granted and exceptionally
     * when it is not, such as {@code GroupAccessChecker}.
     */
    static AuthCheck fromAccessCheck(Supplier<? extends CompletableFuture<?>> accessCheck) {
        return () -> accessCheck.get().thenApply(ignored -> AuthDecision.grant());
    }
}
