package com.parley.security;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Answers "which groups does this user belong to", usually backed by the relational store.
 * <p>
 * Lookups are I/O-bound, so results are asynchronous. Implementations complete the future
 * exceptionally when the backing store fails.
 */
@FunctionalInterface
public interface MembershipDirectory {

    /**
     * Returns the ids of every group the user currently belongs to.
     *
     * @param userId the user to look up
     * @return a future completing with the user's group ids (empty if none)
     */
    CompletableFuture<Set<Long>> groupsOf(long userId);

    /**
     * Returns true if the user belongs to every one of the given groups. An empty collection
     * yields {@code false}: there is nothing to grant access to.
     */
    default CompletableFuture<Boolean> isMemberOfAll(long userId, Collection<Long> groupIds) {
        if (groupIds == null || groupIds.isEmpty()) {
            return CompletableFuture.completedFuture(false);
        }
        return groupsOf(userId).thenApply(groups -> groups.containsAll(groupIds));
    }

    /** Returns true if the user belongs to the given group. */
    default CompletableFuture<Boolean> isMember(long userId, long groupId) {
        return groupsOf(userId).thenApply(groups -> groups.contains(groupId));
    }
}
