package com.tenantguard.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for Micrometer meters with consistent naming and tagging.
 * <p>
 * Every meter carries a {@code service} tag. Meters created through the
 * {@code forTenant} variants additionally carry a {@code tenant} tag; when no tenant
 * is given the tag falls back to the tenant bound in {@link CorrelationContextHolder},
 * or {@value #NO_TENANT} when none is bound.
 */
public final class MetricFactory {

    /** Tag key for tenant segmentation. */
    public static final String TAG_TENANT = "tenant";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Tag value used when no tenant is known. */
    public static final String NO_TENANT = "none";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns (registering on first use) a counter tagged with the service name.
     *
     * @param name        metric name (e.g., "tenant.membership.changes")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Counter tagged with the given tenant, or the context tenant when {@code tenantId} is null.
     */
    public Counter counterForTenant(String name, String description, String tenantId, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags).and(TAG_TENANT, resolveTenant(tenantId)))
                .register(registry);
    }

    /**
     * Returns (registering on first use) a timer tagged with the service name.
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the service name used as a default tag.
     */
    public String serviceName() {
        return serviceName;
    }

    private static String resolveTenant(String tenantId) {
        if (tenantId != null && !tenantId.isBlank()) {
            return tenantId;
        }
        return CorrelationContextHolder.get()
                .map(CorrelationContext::tenantId)
                .orElse(NO_TENANT);
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
