package com.parley.feedservice;

import com.parley.feedservice.config.FeedServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Parley feed service: paginated message history and live subscriptions over HTTP.
 *
 * <p>Wires the pagination engine to a JDBC message store and the topic bus to server-sent-events
 * streams. Key features:
 *
 * <ul>
 *   <li>Cursor-paginated message history per group ({@code /api/v1/groups/{id}/messages})
 *   <li>Authorization-gated live subscriptions ({@code /api/v1/subscriptions/{name}})
 *   <li>Correlation ID propagation into logs, including subscription delivery threads
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 *   <li>Actuator health, metrics and Prometheus endpoints
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(FeedServiceProperties.class)
public class FeedServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(FeedServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(FeedServiceApplication.class, args);
        log.info("Parley feed service started");
    }
}
