package com.parley.security;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when an authenticated user attempts to read or write a group they do not belong to.
 * <p>
 * A RuntimeException: access denial is terminal for the request or subscription that caused it.
 */
public class UnauthorizedException extends RuntimeException {

    private final long userId;
    private final List<Long> groupIds;

    public UnauthorizedException(long userId, Collection<Long> groupIds) {
        super("Unauthorized: user %d is not a member of group(s) %s".formatted(userId, groupIds));
        this.userId = userId;
        this.groupIds = List.copyOf(groupIds);
    }

    public UnauthorizedException(long userId, String reason) {
        super("Unauthorized: user %d %s".formatted(userId, reason));
        this.userId = userId;
        this.groupIds = List.of();
    }

    public long userId() {
        return userId;
    }

    /** Groups the user was denied access to (empty when the denial was not group-specific). */
    public List<Long> groupIds() {
        return groupIds;
    }
}
