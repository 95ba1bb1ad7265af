package com.tenantguard.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that copies the current
 * {@link CorrelationContext} onto every span it opens.
 * <p>
 * The SDK (exporter, sampler) is configured by the hosting service or the Java agent; with
 * nothing configured the global tracer is a no-op and spans cost next to nothing.
 */
public final class SpanHelper {

    /** Span attribute carrying the correlation ID. */
    public static final String ATTR_CORRELATION_ID = "correlation.id";

    /** Span attribute carrying the tenant ID. */
    public static final String ATTR_TENANT_ID = "tenant.id";

    /** Span attribute carrying the acting user ID. */
    public static final String ATTR_USER_ID = "user.id";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new internal span. Runtime exceptions are recorded on the span
     * and rethrown unchanged.
     *
     * @param spanName   name for the span
     * @param attributes extra span attributes
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.tenantId() != null) {
                span.setAttribute(ATTR_TENANT_ID, ctx.tenantId());
            }
            if (ctx.userId() != null) {
                span.setAttribute(ATTR_USER_ID, ctx.userId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, Map.of(), work);
    }

    public Tracer tracer() {
        return tracer;
    }
}
