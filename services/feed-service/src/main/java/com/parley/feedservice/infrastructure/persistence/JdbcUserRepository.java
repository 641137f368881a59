package com.parley.feedservice.infrastructure.persistence;

import com.parley.security.Identity;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Read access to registered users. Accounts are provisioned outside this service. */
@Repository
public class JdbcUserRepository {

    private final JdbcTemplate jdbc;
    private final NamedParameterJdbcTemplate named;

    public JdbcUserRepository(JdbcTemplate jdbc, NamedParameterJdbcTemplate named) {
        this.jdbc = jdbc;
        this.named = named;
    }

    public Optional<Identity> findIdentity(long userId) {
        List<Identity> rows = jdbc.query(
                "SELECT id, username, email FROM users WHERE id = ?",
                (rs, rowNum) -> new Identity(rs.getLong("id"), rs.getString("username"), rs.getString("email")),
                userId);
        return rows.stream().findFirst();
    }

    /** Returns the subset of {@code userIds} that belong to registered users. */
    public Set<Long> findExistingIds(Collection<Long> userIds) {
        if (userIds.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(named.queryForList(
                "SELECT id FROM users WHERE id IN (:ids)", Map.of("ids", userIds), Long.class));
    }
}
