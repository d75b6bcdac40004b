package com.wishmaster.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a context is set, the MDC keys (correlationId, requestId, principalId) are populated
 * so every log statement on this thread includes them. When cleared, all keys are removed.
 * The servlet container reuses threads, so callers must {@link #clear()} in a
 * {@code finally} block once the request completes.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // Utility class: no instantiation
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @param context the correlation context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Binds the authenticated principal to the current context. No-op when no context is set.
     *
     * @param principalId the principal resolved for this request
     */
    public static void bindPrincipal(String principalId) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(current.withPrincipalId(principalId));
        }
    }

    /**
     * Clears the correlation context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_PRINCIPAL_ID);
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
        setMdc(CorrelationContext.MDC_PRINCIPAL_ID, ctx.principalId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
