package com.tenantguard.membership;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Read-only, point-in-time copy of the raw rows the isolation checker inspects.
 * <p>
 * Row records deliberately allow nulls and unknown role labels: the snapshot must be
 * able to represent exactly the corrupted data the checker is looking for.
 *
 * @param tenantIds          ids of all live tenants
 * @param userIds            ids of all live users
 * @param companies          all company rows
 * @param tenantMemberships  all tenant membership rows
 * @param companyMemberships all company membership rows
 * @param takenAt            time the snapshot was taken
 */
public record StoreSnapshot(
        Set<String> tenantIds,
        Set<String> userIds,
        List<CompanyRow> companies,
        List<TenantMemberRow> tenantMemberships,
        List<CompanyMemberRow> companyMemberships,
        Instant takenAt
) {

    public StoreSnapshot {
        tenantIds = Set.copyOf(tenantIds);
        userIds = Set.copyOf(userIds);
        companies = List.copyOf(companies);
        tenantMemberships = List.copyOf(tenantMemberships);
        companyMemberships = List.copyOf(companyMemberships);
    }

    /** Total number of rows in the scanned tables. */
    public int rowCount() {
        return tenantIds.size() + companies.size() + tenantMemberships.size() + companyMemberships.size();
    }

    /** Raw {@code companies} row. */
    public record CompanyRow(String id, String tenantId, String name) {}

    /** Raw {@code tenant_users} row. */
    public record TenantMemberRow(String id, String tenantId, String userId) {}

    /** Raw {@code user_companies} row. */
    public record CompanyMemberRow(String id, String tenantId, String userId, String companyId, String role) {}
}
