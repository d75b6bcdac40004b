package com.wishmaster.observability;

/**
 * Immutable correlation context for a single inbound request.
 * <p>
 * Established by the HTTP layer when a request arrives and enriched with the caller's
 * principal id once bearer authentication succeeds. Every value is mirrored into SLF4J MDC
 * by {@link CorrelationContextHolder} so log lines carry them without explicit arguments.
 *
 * @param correlationId unique ID for the business flow, propagated via {@code X-Correlation-ID}
 * @param requestId     unique ID for this specific request (nullable)
 * @param principalId   authenticated principal performing the request (nullable until authenticated)
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String principalId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for the authenticated principal. */
    public static final String MDC_PRINCIPAL_ID = "principalId";

    /**
     * Compact constructor: correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy of this context bound to the given principal.
     */
    public CorrelationContext withPrincipalId(String principalId) {
        return new CorrelationContext(correlationId, requestId, principalId);
    }
}
