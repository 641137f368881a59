package com.parley.observability;

/**
 * Immutable correlation context for one request or one live subscription.
 * <p>
 * Values are copied into SLF4J MDC by {@link CorrelationContextHolder} so that every log line
 * written while serving the request (or delivering to the subscription) carries them.
 *
 * @param correlationId  unique ID for the request, echoed to the client (never null)
 * @param userId         authenticated user, nullable for anonymous requests
 * @param subscriptionId live subscription being served, nullable outside the delivery path
 */
public record CorrelationContext(String correlationId, String userId, String subscriptionId) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for subscription ID. */
    public static final String MDC_SUBSCRIPTION_ID = "subscriptionId";

    /**
     * Compact constructor: correlationId is required.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates a context carrying only a correlation ID. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null);
    }

    /** Returns a copy of this context with the given user ID. */
    public CorrelationContext withUserId(String newUserId) {
        return new CorrelationContext(correlationId, newUserId, subscriptionId);
    }

    /** Returns a copy of this context with the given subscription ID. */
    public CorrelationContext withSubscriptionId(String newSubscriptionId) {
        return new CorrelationContext(correlationId, userId, newSubscriptionId);
    }
}
