package com.parley.feedservice.infrastructure.web;

import com.parley.feedservice.infrastructure.persistence.JdbcUserRepository;
import com.parley.security.Identity;
import com.parley.security.UnauthenticatedException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the caller's {@link Identity} from the {@code X-User-Id} header.
 *
 * <p>Credentials are verified upstream (gateway); this service trusts the header and only checks
 * that it names a registered user.
 */
@Component
public class IdentityResolver {

    public static final String USER_ID_HEADER = "X-User-Id";

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final JdbcUserRepository users;

    public IdentityResolver(JdbcUserRepository users) {
        this.users = users;
    }

    /**
     * Returns the caller, or {@code null} when the request carries no identity. Operations decide
     * for themselves whether an anonymous caller is acceptable.
     *
     * @throws UnauthenticatedException if the header is present but malformed or names no user
     */
    public Identity resolve(HttpServletRequest request) {
        String header = request.getHeader(USER_ID_HEADER);
        if (header == null || header.isBlank()) {
            return null;
        }
        long userId;
        try {
            userId = Long.parseLong(header.strip());
        } catch (NumberFormatException e) {
            throw new UnauthenticatedException("Malformed " + USER_ID_HEADER + " header");
        }
        if (userId <= 0) {
            throw new UnauthenticatedException("Malformed " + USER_ID_HEADER + " header");
        }
        return users.findIdentity(userId).orElseThrow(() -> {
            log.warn("Request for unknown user {}", userId);
            return new UnauthenticatedException("Unknown user");
        });
    }
}
