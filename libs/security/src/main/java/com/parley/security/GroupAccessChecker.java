package com.parley.security;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous membership-based access checks.
 *
 * <p>Each check completes normally when access is granted and exceptionally with
 * {@link UnauthenticatedException} or {@link UnauthorizedException} when it is not. Store failures
 * propagate unchanged so callers can tell "denied" apart from "could not decide".
 */
public final class GroupAccessChecker {

    private final MembershipDirectory directory;

    public GroupAccessChecker(MembershipDirectory directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        this.directory = directory;
    }

    /** Grants access if the identity belongs to the given group. */
    public CompletableFuture<Void> checkCanAccess(Identity identity, long groupId) {
        return checkCanAccessAll(identity, List.of(groupId));
    }

    /**
     * Grants access if the identity belongs to every given group. An empty collection is denied.
     */
    public CompletableFuture<Void> checkCanAccessAll(Identity identity, Collection<Long> groupIds) {
        if (identity == null) {
            return CompletableFuture.failedFuture(new UnauthenticatedException());
        }
        List<Long> requested = groupIds == null ? List.of() : List.copyOf(groupIds);
        return directory.isMemberOfAll(identity.userId(), requested)
                .thenAccept(member -> {
                    if (!member) {
                        throw new UnauthorizedException(identity.userId(), requested);
                    }
                });
    }

    /** Returns the directory used for lookups. */
    public MembershipDirectory directory() {
        return directory;
    }
}
