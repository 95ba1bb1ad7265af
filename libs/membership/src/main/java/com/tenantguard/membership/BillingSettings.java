package com.tenantguard.membership;

import java.util.Map;

/**
 * Billing payload persisted with a tenant as-is.
 *
 * @param plan     subscription plan name, {@value #DEFAULT_PLAN} when not given
 * @param status   subscription state, {@link BillingStatus#ACTIVE} when not given
 * @param settings free-form settings, never interpreted by this subsystem
 */
public record BillingSettings(String plan, BillingStatus status, Map<String, Object> settings) {

    public static final String DEFAULT_PLAN = "free";

    public BillingSettings {
        if (plan == null || plan.isBlank()) {
            plan = DEFAULT_PLAN;
        }
        if (status == null) {
            status = BillingStatus.ACTIVE;
        }
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public static BillingSettings defaults() {
        return new BillingSettings(null, null, null);
    }

    /**
     * Overlays the non-null parts of {@code patch} on top of this payload.
     * An empty settings map in the patch keeps the current settings.
     */
    public BillingSettings merge(BillingPatch patch) {
        if (patch == null) {
            return this;
        }
        return new BillingSettings(
                patch.plan() != null ? patch.plan() : plan,
                patch.status() != null ? patch.status() : status,
                patch.settings() != null && !patch.settings().isEmpty() ? patch.settings() : settings);
    }

    /**
     * Partial billing update; null fields are left untouched.
     */
    public record BillingPatch(String plan, BillingStatus status, Map<String, Object> settings) {

        public boolean isEmpty() {
            return plan == null && status == null && (settings == null || settings.isEmpty());
        }
    }
}
