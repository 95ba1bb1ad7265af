package com.tenantguard.membership;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistence port for tenants, companies and memberships.
 * <p>
 * Implementations are dumb and consistent: no authorization logic lives behind this
 * interface. Every failure of the underlying storage surfaces as a {@link StoreException};
 * nothing is swallowed.
 *
 * <h2>Tenant scoping</h2>
 * Inside {@link #withTenantContext(String, Supplier)} all tenant-scoped reads only see rows
 * of that tenant, and writes addressed to another tenant are rejected with a
 * {@link StoreException}. {@link #withoutTenantContext(Supplier)} lifts the scoping for
 * cross-tenant work. Scopes are bound to the calling thread and never shared between
 * concurrent requests.
 *
 * <h2>Transactions</h2>
 * {@link #inTransaction(Supplier)} runs a block atomically; nested calls join the outer
 * transaction. {@link #lockTenant(String)} takes an exclusive lock on one tenant that is held
 * until the surrounding transaction ends, serializing membership writers of that tenant only.
 */
public interface MembershipStore {

    // ── Tenants ──

    Optional<Tenant> getTenant(String tenantId);

    /** Inserts a tenant with a generated id. */
    Tenant insertTenant(String name);

    /** Renames a tenant and bumps its update time; empty when the tenant does not exist. */
    Optional<Tenant> updateTenantName(String tenantId, String name);

    /** Bumps the tenant's update time without changing anything else. */
    void touchTenant(String tenantId);

    Optional<BillingSettings> getBillingSettings(String tenantId);

    /** Inserts or replaces the tenant's billing payload. */
    void saveBillingSettings(String tenantId, BillingSettings settings);

    // ── Users ──

    Optional<UserAccount> getUser(String userId);

    // ── Companies ──

    Optional<Company> getCompany(String companyId);

    /** Inserts a company with a generated id. */
    Company insertCompany(String tenantId, String name);

    /** Renames a company; its tenant never changes. Empty when the company does not exist. */
    Optional<Company> updateCompanyName(String companyId, String name);

    List<Company> listCompaniesForTenant(String tenantId);

    int countCompanies(String tenantId);

    // ── Tenant memberships ──

    Optional<TenantMembership> getMembership(String tenantId, String userId);

    List<TenantMembership> listMembershipsForUser(String userId);

    List<TenantMembership> listMembershipsForTenant(String tenantId);

    int countMembers(String tenantId);

    void insertMembership(String tenantId, String userId, TenantRoles roles);

    /** Overwrites the role set; false when no such membership exists. */
    boolean updateMembershipRoles(String tenantId, String userId, TenantRoles roles);

    /** Deletes the tenant membership row; false when no such membership exists. */
    boolean deleteMembership(String tenantId, String userId);

    // ── Company memberships ──

    Optional<CompanyMembership> getCompanyMembership(String companyId, String userId);

    List<CompanyMembership> listCompanyMembershipsForUser(String userId);

    List<CompanyMembership> listCompanyMembershipsForTenant(String tenantId);

    void insertCompanyMembership(String tenantId, String companyId, String userId, CompanyRole role);

    boolean updateCompanyMembershipRole(String companyId, String userId, CompanyRole role);

    boolean deleteCompanyMembership(String companyId, String userId);

    /** Deletes every company membership the user holds inside the tenant; returns the row count. */
    int deleteCompanyMembershipsForUser(String tenantId, String userId);

    // ── Execution context ──

    /** Runs {@code work} atomically, joining an already active transaction. */
    <T> T inTransaction(Supplier<T> work);

    /**
     * Takes the exclusive per-tenant write lock for the rest of the current transaction.
     *
     * @throws StoreException if called outside {@link #inTransaction(Supplier)}
     */
    void lockTenant(String tenantId);

    /** Runs {@code work} with tenant scoping applied for {@code tenantId}. */
    <T> T withTenantContext(String tenantId, Supplier<T> work);

    /** Runs {@code work} with tenant scoping lifted. */
    <T> T withoutTenantContext(Supplier<T> work);

    /** The tenant currently scoping this thread's queries, if any. */
    Optional<String> currentTenant();

    /** Consistent read-only copy of the raw rows, ignoring any tenant scope. */
    StoreSnapshot snapshot();
}
