package com.tenantguard.tenantservice.domain;

import com.tenantguard.authorization.TenantException;
import com.tenantguard.authorization.TenantStoreException;
import com.tenantguard.membership.StoreException;
import com.tenantguard.observability.CorrelationContextHolder;
import com.tenantguard.observability.MetricFactory;
import com.tenantguard.observability.SpanHelper;
import io.micrometer.core.instrument.Timer;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one facade operation: binds the tenant to the logging context, opens a span, times the
 * call and counts its outcome. Store failures become {@link TenantStoreException}.
 * <p>
 * Domain rejections pass through unchanged. The raw store message stays in the cause and the
 * log; callers only see {@code "Failed to <operation>"}.
 */
public final class OperationGuard {

    static final String OPERATIONS_METRIC = "tenantguard.operations";
    static final String DURATION_METRIC = "tenantguard.operation.duration";

    private static final Logger log = LoggerFactory.getLogger(OperationGuard.class);

    private final MetricFactory metrics;
    private final SpanHelper spans;

    public OperationGuard(MetricFactory metrics, SpanHelper spans) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.spans = Objects.requireNonNull(spans, "spans");
    }

    /**
     * @param operation short human-readable operation name, e.g. "add user to tenant"
     * @param tenantId tenant the operation addresses; null for cross-tenant operations
     */
    public <T> T run(String operation, String tenantId, Supplier<T> work) {
        Timer.Sample sample = Timer.start(metrics.registry());
        String outcome = "success";
        try {
            Supplier<T> traced = () -> spans.inSpan(operation, spanAttributes(operation, tenantId), work);
            return tenantId == null ? traced.get() : CorrelationContextHolder.callInTenant(tenantId, traced);
        } catch (StoreException e) {
            outcome = "store_error";
            log.error("Store failure during '{}' for tenant={}", operation, tenantId, e);
            throw new TenantStoreException("Failed to " + operation, tenantId, e);
        } catch (TenantException e) {
            outcome = e.kind().code().toLowerCase(Locale.ROOT);
            log.warn("Rejected '{}' for tenant={}: {}", operation, tenantId, e.getMessage());
            throw e;
        } finally {
            sample.stop(metrics.timer(DURATION_METRIC, "Facade operation latency", "operation", operation));
            metrics.counterForTenant(OPERATIONS_METRIC, "Facade operations by outcome", tenantId,
                    "operation", operation, "outcome", outcome).increment();
        }
    }

    /** Variant for operations without a result. */
    public void runVoid(String operation, String tenantId, Runnable work) {
        run(operation, tenantId, () -> {
            work.run();
            return null;
        });
    }

    private static Map<String, String> spanAttributes(String operation, String tenantId) {
        return tenantId == null
                ? Map.of("operation", operation)
                : Map.of("operation", operation, "tenant", tenantId);
    }
}
