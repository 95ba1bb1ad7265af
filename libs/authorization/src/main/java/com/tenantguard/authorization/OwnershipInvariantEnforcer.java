package com.tenantguard.authorization;

import com.tenantguard.membership.CompanyMembership;
import com.tenantguard.membership.CompanyRole;
import com.tenantguard.membership.MembershipStore;
import com.tenantguard.membership.TenantMembership;
import com.tenantguard.membership.TenantRoles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Guards the ownership invariant: a tenant that has an owner never loses its last one.
 * <p>
 * An owner is any user holding the {@code owner} tenant label or the {@link CompanyRole#OWNER}
 * role in any company of the tenant. Every {@code check*} method takes the tenant's write lock
 * through {@link MembershipStore#lockTenant(String)} before counting, so it must run inside
 * {@link MembershipStore#inTransaction} together with the write it guards. Concurrent writers of
 * the same tenant are serialized; two "remove last owner" requests can never both pass.
 * <p>
 * A change is refused only when it takes the owner count from at least one to zero. Tenants
 * that are already owner-less (legacy data) are reported by the isolation checker instead.
 */
public final class OwnershipInvariantEnforcer {

    private static final Logger log = LoggerFactory.getLogger(OwnershipInvariantEnforcer.class);

    private final MembershipStore store;

    public OwnershipInvariantEnforcer(MembershipStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Pure query: whether the user is currently the one and only owner of the tenant.
     * Uses the same counting as the checks below, without taking the lock.
     */
    public boolean isOnlyTenantOwner(String userId, String tenantId) {
        Owners owners = owners(tenantId);
        return owners.wouldBeOwnerless(owners.withoutUser(userId));
    }

    /**
     * Pure query: whether the user is the only owner of one company.
     */
    public boolean isOnlyCompanyOwner(String userId, String tenantId, String companyId) {
        Set<String> companyOwners = new HashSet<>();
        for (CompanyMembership m : store.listCompanyMembershipsForTenant(tenantId)) {
            if (companyId.equals(m.companyId()) && m.role() == CompanyRole.OWNER) {
                companyOwners.add(m.userId());
            }
        }
        return companyOwners.size() == 1 && companyOwners.contains(userId);
    }

    /** Number of distinct owners of the tenant. */
    public int countOwners(String tenantId) {
        return owners(tenantId).all().size();
    }

    /**
     * Refuses removing the user from the tenant (tenant row and all company rows) when the
     * user is the last owner.
     */
    public void checkRemoval(String tenantId, String userId, String actingUserId) {
        store.lockTenant(tenantId);
        Owners owners = owners(tenantId);
        if (owners.wouldBeOwnerless(owners.withoutUser(userId))) {
            String message = userId.equals(actingUserId)
                    ? "Cannot remove yourself as the only tenant owner"
                    : "Cannot remove the only tenant owner";
            throw refuse(message, tenantId, userId);
        }
    }

    /**
     * Refuses replacing the user's tenant labels with {@code newRoles} when that strips the
     * last owner.
     */
    public void checkTenantRoleChange(String tenantId, String userId, TenantRoles newRoles) {
        store.lockTenant(tenantId);
        Owners owners = owners(tenantId);
        Set<String> tenantOwners = new HashSet<>(owners.tenantOwners());
        tenantOwners.remove(userId);
        if (newRoles.isOwner()) {
            tenantOwners.add(userId);
        }
        Set<String> after = union(tenantOwners, owners.companyOwners());
        if (owners.wouldBeOwnerless(after)) {
            throw refuse("Cannot remove the owner role from the only tenant owner", tenantId, userId);
        }
    }

    /**
     * Refuses changing (or, with a null {@code newRole}, removing) the user's role in one
     * company when that strips the last owner of the tenant.
     */
    public void checkCompanyRoleChange(String tenantId, String companyId, String userId, CompanyRole newRole) {
        store.lockTenant(tenantId);
        Owners owners = owners(tenantId);
        Set<String> companyOwners = new HashSet<>();
        for (CompanyMembership m : store.listCompanyMembershipsForTenant(tenantId)) {
            boolean target = companyId.equals(m.companyId()) && userId.equals(m.userId());
            if (!target && m.role() == CompanyRole.OWNER) {
                companyOwners.add(m.userId());
            }
        }
        if (newRole == CompanyRole.OWNER) {
            companyOwners.add(userId);
        }
        Set<String> after = union(owners.tenantOwners(), companyOwners);
        if (owners.wouldBeOwnerless(after)) {
            throw refuse("Cannot remove the only owner of the tenant", tenantId, userId);
        }
    }

    private OwnershipInvariantException refuse(String message, String tenantId, String userId) {
        log.warn("Ownership invariant refused change: tenant={} user={} reason='{}'", tenantId, userId, message);
        return new OwnershipInvariantException(message, tenantId, userId);
    }

    private Owners owners(String tenantId) {
        Set<String> tenantOwners = new HashSet<>();
        for (TenantMembership m : store.listMembershipsForTenant(tenantId)) {
            if (m.roles().isOwner()) {
                tenantOwners.add(m.userId());
            }
        }
        Set<String> companyOwners = new HashSet<>();
        for (CompanyMembership m : store.listCompanyMembershipsForTenant(tenantId)) {
            if (m.role() == CompanyRole.OWNER) {
                companyOwners.add(m.userId());
            }
        }
        return new Owners(Set.copyOf(tenantOwners), Set.copyOf(companyOwners));
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> all = new HashSet<>(a);
        all.addAll(b);
        return all;
    }

    private record Owners(Set<String> tenantOwners, Set<String> companyOwners) {

        Set<String> all() {
            return union(tenantOwners, companyOwners);
        }

        Set<String> withoutUser(String userId) {
            Set<String> remaining = all();
            remaining.remove(userId);
            return remaining;
        }

        boolean wouldBeOwnerless(Set<String> after) {
            return !all().isEmpty() && after.isEmpty();
        }
    }
}
