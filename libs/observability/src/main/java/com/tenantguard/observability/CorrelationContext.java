package com.tenantguard.observability;

/**
 * Immutable correlation context that flows with a single logical request.
 * <p>
 * Every incoming call (HTTP request, scheduled isolation pass) establishes a
 * {@code CorrelationContext}; its values are pushed into SLF4J MDC by
 * {@link CorrelationContextHolder} so that every log line carries them.
 *
 * @param correlationId unique ID for the business flow
 * @param tenantId      tenant the request currently operates on (nullable outside a tenant scope)
 * @param userId        acting user (nullable for system work such as the isolation job)
 * @param requestId     unique ID for this specific request (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for acting user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context that carries only a correlation ID.
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /**
     * Returns a copy of this context bound to another tenant (or to none when {@code null}).
     */
    public CorrelationContext withTenant(String tenantId) {
        return new CorrelationContext(correlationId, tenantId, userId, requestId);
    }

    /**
     * Returns a copy of this context with the acting user replaced.
     */
    public CorrelationContext withUser(String userId) {
        return new CorrelationContext(correlationId, tenantId, userId, requestId);
    }
}
