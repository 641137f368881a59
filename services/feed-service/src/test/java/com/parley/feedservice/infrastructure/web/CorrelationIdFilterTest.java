package com.parley.feedservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.parley.observability.CorrelationContext;
import com.parley.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private CorrelationContext contextDuring(MockHttpServletRequest request) throws Exception {
        var captured = new AtomicReference<CorrelationContext>();
        FilterChain chain = (req, resp) -> captured.set(CorrelationContextHolder.get().orElse(null));
        filter.doFilter(request, new MockHttpServletResponse(), chain);
        return captured.get();
    }

    @Test
    @DisplayName("generates a correlation ID when none is provided")
    void generatesCorrelationId() throws Exception {
        var response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest(), response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isNotBlank();
    }

    @Test
    @DisplayName("propagates the caller's correlation ID")
    void propagatesCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "test-abc-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("test-abc-123");
    }

    @Test
    @DisplayName("puts a numeric X-User-Id into the context")
    void capturesUserId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "during-chain");
        request.addHeader("X-User-Id", "42");

        var context = contextDuring(request);

        assertThat(context.correlationId()).isEqualTo("during-chain");
        assertThat(context.userId()).isEqualTo("42");
    }

    @Test
    @DisplayName("ignores a malformed X-User-Id")
    void ignoresMalformedUserId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-User-Id", "42; DROP TABLE users");

        assertThat(contextDuring(request).userId()).isNull();
    }

    @Test
    @DisplayName("clears the context after the request completes")
    void clearsContext() throws Exception {
        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), (req, resp) -> {});

        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
