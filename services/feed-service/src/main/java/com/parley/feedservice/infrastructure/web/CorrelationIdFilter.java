package com.parley.feedservice.infrastructure.web;

import com.parley.observability.CorrelationContext;
import com.parley.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that propagates or generates a correlation ID for every HTTP request.
 *
 * <p>If the client sends {@code X-Correlation-ID} it is propagated, otherwise a UUID is generated.
 * The ID is placed in {@link CorrelationContextHolder} (and so in the SLF4J MDC) together with the
 * caller's user id, and echoed on the response. Subscriptions opened during the request inherit
 * the context for their delivery threads.
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so correlation is available to all subsequent
 * filters and handlers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        String userId = request.getHeader(IdentityResolver.USER_ID_HEADER);
        var context = CorrelationContext.of(correlationId)
                .withUserId(userId != null && userId.matches("\\d{1,19}") ? userId : null);
        CorrelationContextHolder.set(context);

        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Servlet threads are pooled.
            CorrelationContextHolder.clear();
        }
    }
}
