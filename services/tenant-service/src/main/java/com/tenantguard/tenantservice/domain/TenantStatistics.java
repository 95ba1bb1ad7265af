package com.tenantguard.tenantservice.domain;

import java.time.Instant;

/**
 * Aggregate counts for one tenant.
 *
 * @param userCount number of tenant members
 * @param companyCount number of companies
 * @param billingStatus billing status, or {@value #UNKNOWN_STATUS} without a billing record
 * @param subscriptionPlan plan name, or the free plan without a billing record
 * @param createdAt tenant creation time
 */
public record TenantStatistics(
        int userCount, int companyCount, String billingStatus, String subscriptionPlan, Instant createdAt) {

    public static final String UNKNOWN_STATUS = "unknown";
}
