package com.parley.feedservice.config;

import com.parley.eventbus.GatePolicy;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the feed service, bound from {@code parley.feed.*}.
 *
 * <p>Spring Boot binds YAML/env properties to this record at startup and validates them via Bean
 * Validation; invalid config fails the startup with a clear message.
 *
 * <pre>
 * parley:
 *   feed:
 *     name: feed-service
 *     default-page-size: 20
 *     max-page-size: 100
 *     channel-buffer-size: 256
 *     auth-timeout: 10s
 *     gate-policy: BUFFER
 * </pre>
 *
 * @param name service name used as the metrics tag. Required.
 * @param environment deployment environment (development, staging, production).
 * @param defaultPageSize page size when a request names no count.
 * @param maxPageSize upper bound on any requested count.
 * @param channelBufferSize events buffered per subscriber before the oldest is dropped.
 * @param deliveryThreads threads delivering events to subscribers.
 * @param authTimeout how long a subscription may wait for its authorization check.
 * @param gatePolicy what happens to events published while authorization is pending.
 * @param sseTimeout idle lifetime of an event stream before the server closes it.
 * @param corsAllowedOrigins browser origins allowed to call {@code /api/**}.
 */
@ConfigurationProperties(prefix = "parley.feed")
@Validated
public record FeedServiceProperties(
        @NotBlank String name,
        String environment,
        int defaultPageSize,
        int maxPageSize,
        int channelBufferSize,
        int deliveryThreads,
        Duration authTimeout,
        GatePolicy gatePolicy,
        Duration sseTimeout,
        List<String> corsAllowedOrigins) {

    /** Compact constructor: applies defaults before Bean Validation runs. */
    public FeedServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (defaultPageSize <= 0) {
            defaultPageSize = 20;
        }
        if (maxPageSize <= 0) {
            maxPageSize = 100;
        }
        if (defaultPageSize > maxPageSize) {
            throw new IllegalArgumentException(
                    "default-page-size (" + defaultPageSize + ") exceeds max-page-size (" + maxPageSize + ")");
        }
        if (channelBufferSize <= 0) {
            channelBufferSize = 256;
        }
        if (deliveryThreads <= 0) {
            deliveryThreads = 4;
        }
        if (authTimeout == null || authTimeout.isZero() || authTimeout.isNegative()) {
            authTimeout = Duration.ofSeconds(10);
        }
        if (gatePolicy == null) {
            gatePolicy = GatePolicy.BUFFER;
        }
        if (sseTimeout == null || sseTimeout.isNegative()) {
            sseTimeout = Duration.ofMinutes(30);
        }
        corsAllowedOrigins = corsAllowedOrigins == null ? List.of() : List.copyOf(corsAllowedOrigins);
    }
}
