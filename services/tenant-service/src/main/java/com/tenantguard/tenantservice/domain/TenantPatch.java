package com.tenantguard.tenantservice.domain;

import com.tenantguard.membership.BillingSettings.BillingPatch;

/**
 * Partial tenant update. Null fields are left unchanged.
 *
 * @param name new tenant name
 * @param billing billing fields to merge into the stored billing record
 */
public record TenantPatch(String name, BillingPatch billing) {

    public static TenantPatch rename(String name) {
        return new TenantPatch(name, null);
    }

    public boolean isEmpty() {
        return name == null && (billing == null || billing.isEmpty());
    }
}
