package com.parley.security;

import java.util.concurrent.CompletionException;

/**
 * Blocking variant of {@link GroupAccessChecker} for request/response paths.
 * <p>
 * Fails fast with {@link UnauthenticatedException} or {@link UnauthorizedException}; any other
 * failure of the underlying lookup is rethrown as-is.
 */
public final class GroupAccessEnforcer {

    private final GroupAccessChecker checker;

    public GroupAccessEnforcer(GroupAccessChecker checker) {
        this.checker = checker;
    }

    /**
     * Verifies that the identity is a member of the group, waiting for the lookup to finish.
     *
     * @param identity the caller, or null if the request carried no identity
     * @param groupId  the group being read or written
     * @throws UnauthenticatedException if identity is null
     * @throws UnauthorizedException    if the caller is not a member
     */
    public void enforce(Identity identity, long groupId) {
        try {
            checker.checkCanAccess(identity, groupId).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
