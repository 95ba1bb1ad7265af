package com.tenantguard.authorization;

import com.tenantguard.membership.Company;
import com.tenantguard.membership.MembershipStore;

/**
 * Write-path guard for tenant-scope consistency.
 * <p>
 * Every company membership write passes through here so that
 * {@code membership.tenantId == company.tenantId} holds by construction; the isolation checker
 * only has to detect rows written around this guard.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that the company belongs to the tenant the write is addressed to.
     *
     * @throws TenantMismatchException if the tenants differ
     */
    public static void enforce(String tenantId, Company company) {
        if (!tenantId.equals(company.tenantId())) {
            throw new TenantMismatchException(tenantId, company.tenantId());
        }
    }

    /**
     * Verifies that a store call made under a tenant context addresses that same tenant.
     * A store without an active tenant context accepts any tenant.
     *
     * @throws TenantMismatchException if the active context belongs to another tenant
     */
    public static void enforceContext(MembershipStore store, String tenantId) {
        store.currentTenant().ifPresent(current -> {
            if (!current.equals(tenantId)) {
                throw new TenantMismatchException(current, tenantId);
            }
        });
    }
}
