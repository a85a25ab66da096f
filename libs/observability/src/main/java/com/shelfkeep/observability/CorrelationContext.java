package com.shelfkeep.observability;

import java.util.List;

/**
 * Immutable correlation context that flows with one request.
 * <p>
 * Every incoming HTTP request establishes a {@code CorrelationContext}; once the verified actor
 * is known it is enriched with the tenant and member ids. The values are injected into SLF4J MDC
 * so every log line of the request carries them.
 *
 * @param correlationId unique ID for the request chain (echoed to the client)
 * @param tenantId      tenant of the acting member (nullable until resolved, or for global actors)
 * @param userId        acting member id (nullable until resolved)
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId
) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for tenant ID.
     */
    public static final String MDC_TENANT_ID = "tenantId";

    /**
     * MDC key for user ID.
     */
    public static final String MDC_USER_ID = "userId";

    /** Every MDC key a context writes, in log-pattern order. */
    public static final List<String> MDC_KEYS = List.of(MDC_CORRELATION_ID, MDC_TENANT_ID, MDC_USER_ID);

    /**
     * Rejects a null correlationId.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** A context carrying only a correlation id. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null);
    }

    /** Returns a copy bound to the given actor. */
    public CorrelationContext withActor(String tenantId, String userId) {
        return new CorrelationContext(correlationId, tenantId, userId);
    }

    /** Value written to the MDC under {@code key}, or {@code null} when unset. */
    public String mdcValue(String key) {
        return switch (key) {
            case MDC_CORRELATION_ID -> correlationId;
            case MDC_TENANT_ID -> tenantId;
            case MDC_USER_ID -> userId;
            default -> throw new IllegalArgumentException("Unknown MDC key: " + key);
        };
    }
}
