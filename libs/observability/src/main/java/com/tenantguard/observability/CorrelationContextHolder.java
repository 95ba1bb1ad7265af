package com.tenantguard.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a correlation context is set, the MDC keys (correlationId, tenantId, userId,
 * requestId) are populated so that every log statement on this thread includes them.
 * When cleared, all MDC keys are removed.
 * <p>
 * Contexts never cross threads on their own. Work handed to another thread must be
 * wrapped with {@link #runWithContext(CorrelationContext, Runnable)} or
 * {@link #callWithContext(CorrelationContext, Supplier)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // Utility class
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
     * Returns the current context, or a fresh one with a generated correlation ID.
     */
    public static CorrelationContext currentOrNew() {
        CorrelationContext current = CONTEXT.get();
        return current != null ? current : CorrelationContext.of(UUID.randomUUID().toString());
    }

    /**
     * Clears the correlation context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Executes a {@link Runnable} with the given correlation context set, then restores
     * the previous context (or clears if there was none).
     *
     * @param context the correlation context for the duration of the runnable
     * @param runnable the work to execute
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        callWithContext(context, () -> {
            runnable.run();
            return null;
        });
    }

    /**
     * Value-returning variant of {@link #runWithContext(CorrelationContext, Runnable)}.
     * Exceptions thrown by the supplier propagate unchanged after the previous context
     * has been restored.
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * Runs {@code work} with the current context rebound to {@code tenantId}.
     * A thread without a context gets a fresh one for the duration of the call.
     */
    public static <T> T callInTenant(String tenantId, Supplier<T> work) {
        return callWithContext(currentOrNew().withTenant(tenantId), work);
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(CorrelationContext.MDC_USER_ID, ctx.userId());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }
}
