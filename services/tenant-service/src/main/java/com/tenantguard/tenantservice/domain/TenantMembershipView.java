package com.tenantguard.tenantservice.domain;

import com.tenantguard.membership.Tenant;
import com.tenantguard.membership.TenantRoles;
import java.time.Instant;
import java.util.List;

/**
 * One tenant a user belongs to, with the user's tenant labels and company memberships there.
 *
 * @param tenant the tenant
 * @param roles the user's tenant-level labels
 * @param joinedAt when the user joined the tenant
 * @param companies the user's companies in this tenant, ordered by name
 */
public record TenantMembershipView(
        Tenant tenant, TenantRoles roles, Instant joinedAt, List<CompanyMembershipView> companies) {

    public TenantMembershipView {
        companies = List.copyOf(companies);
    }
}
