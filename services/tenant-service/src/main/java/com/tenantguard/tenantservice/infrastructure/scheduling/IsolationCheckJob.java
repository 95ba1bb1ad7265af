package com.tenantguard.tenantservice.infrastructure.scheduling;

import com.tenantguard.authorization.isolation.IsolationReport;
import com.tenantguard.authorization.isolation.TenantIsolationChecker;
import com.tenantguard.membership.StoreException;
import com.tenantguard.observability.CorrelationContext;
import com.tenantguard.observability.CorrelationContextHolder;
import com.tenantguard.observability.MetricFactory;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic tenant isolation pass. Detection only; violations are logged and counted, never
 * repaired.
 */
@Component
@ConditionalOnProperty(prefix = "tenantguard.isolation", name = "enabled", havingValue = "true")
public class IsolationCheckJob {

    static final String VIOLATIONS_METRIC = "tenantguard.isolation.violations";
    static final String RUNS_METRIC = "tenantguard.isolation.runs";

    private static final Logger log = LoggerFactory.getLogger(IsolationCheckJob.class);

    private final TenantIsolationChecker checker;
    private final MetricFactory metrics;
    private final AtomicReference<IsolationReport> lastReport = new AtomicReference<>();

    public IsolationCheckJob(TenantIsolationChecker checker, MetricFactory metrics) {
        this.checker = checker;
        this.metrics = metrics;
    }

    @Scheduled(
            fixedDelayString = "${tenantguard.isolation.interval:PT1H}",
            initialDelayString = "${tenantguard.isolation.initial-delay:PT1M}")
    public void runScheduled() {
        try {
            runOnce();
        } catch (StoreException e) {
            // Next run retries; the scheduler must keep its thread.
            log.error("Tenant isolation check could not read the store", e);
            metrics.counter(RUNS_METRIC, "Isolation check runs", "outcome", "store_error").increment();
        }
    }

    /** Runs one pass and records its result. */
    public IsolationReport runOnce() {
        IsolationReport report = CorrelationContextHolder.callWithContext(
                CorrelationContext.of("isolation-" + UUID.randomUUID()), checker::run);
        lastReport.set(report);
        metrics.counter(RUNS_METRIC, "Isolation check runs", "outcome", report.isClean() ? "clean" : "violations")
                .increment();
        report.violations().forEach(v -> metrics.counter(VIOLATIONS_METRIC, "Rows violating tenant isolation",
                "table", v.table(), "type", v.type().name()).increment(v.violatingRowIds().size()));
        return report;
    }

    public Optional<IsolationReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }
}
