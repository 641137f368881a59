package com.parley.security;

/**
 * An authenticated principal, already validated upstream.
 * <p>
 * Credential issuance and verification happen outside this library; by the time an
 * {@code Identity} exists, the caller is known to be who it claims. Group memberships are not
 * carried here: they are queried through {@link MembershipDirectory}, because they change while a
 * subscription is open.
 *
 * @param userId   unique user identifier
 * @param username login name shown to other users
 * @param email    user's email address
 */
public record Identity(long userId, String username, String email) {

    /** Compact constructor: user ids are store-assigned and strictly positive. */
    public Identity {
        if (userId <= 0) {
            throw new IllegalArgumentException("userId must be positive");
        }
    }
}
