package com.tenantguard.tenantservice.domain;

import com.tenantguard.authorization.AccessValidator;
import com.tenantguard.authorization.EffectiveRole;
import com.tenantguard.authorization.MembershipNotFoundException;
import com.tenantguard.authorization.OwnershipInvariantEnforcer;
import com.tenantguard.authorization.TenantAccessException;
import com.tenantguard.authorization.TenantNotFoundException;
import com.tenantguard.authorization.TenantValidationException;
import com.tenantguard.authorization.UserNotFoundException;
import com.tenantguard.membership.BillingSettings;
import com.tenantguard.membership.Company;
import com.tenantguard.membership.CompanyMembership;
import com.tenantguard.membership.CompanyRole;
import com.tenantguard.membership.MembershipStore;
import com.tenantguard.membership.Tenant;
import com.tenantguard.membership.TenantMembership;
import com.tenantguard.membership.TenantRoles;
import com.tenantguard.membership.UserAccount;
import com.tenantguard.observability.CorrelationContextHolder;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for tenant lifecycle and tenant membership management.
 *
 * <p>Every membership write goes through this facade (or {@link CompanyService}), so access and
 * the ownership invariant are always checked. Mutations of one tenant run in a store transaction
 * holding that tenant's lock. The caller's role, the owner count, the invariant check and the
 * write are read and applied under that lock, and concurrent writers of the same tenant are
 * serialized. Unrelated tenants never wait on each other.
 *
 * <p>Access is checked before existence, so a caller without access to a tenant cannot learn
 * whether it exists. Granting, revoking or removing the {@code owner} label requires an
 * owner-level caller.
 */
public class TenantService {

    private static final Logger log = LoggerFactory.getLogger(TenantService.class);

    private final MembershipStore store;
    private final AccessValidator accessValidator;
    private final OwnershipInvariantEnforcer ownershipEnforcer;
    private final OperationGuard guard;

    public TenantService(
            MembershipStore store,
            AccessValidator accessValidator,
            OwnershipInvariantEnforcer ownershipEnforcer,
            OperationGuard guard) {
        this.store = Objects.requireNonNull(store, "store");
        this.accessValidator = Objects.requireNonNull(accessValidator, "accessValidator");
        this.ownershipEnforcer = Objects.requireNonNull(ownershipEnforcer, "ownershipEnforcer");
        this.guard = Objects.requireNonNull(guard, "guard");
    }

    // ── Queries ──

    public Optional<Tenant> getTenantById(String tenantId) {
        InputValidation.requireId("tenantId", tenantId);
        return guard.run("retrieve tenant", tenantId,
                () -> store.withoutTenantContext(() -> store.getTenant(tenantId)));
    }

    /**
     * All tenants the user belongs to, ordered by tenant name, each with the user's companies
     * in that tenant. Memberships pointing at missing tenants or companies are skipped.
     */
    public List<TenantMembershipView> getUserTenants(String userId) {
        InputValidation.requireId("userId", userId);
        return guard.run("retrieve user tenants", null, () -> store.withoutTenantContext(() -> {
            List<CompanyMembership> companyMemberships = store.listCompanyMembershipsForUser(userId);
            List<TenantMembershipView> views = new ArrayList<>();
            for (TenantMembership membership : store.listMembershipsForUser(userId)) {
                Optional<Tenant> tenant = store.getTenant(membership.tenantId());
                if (tenant.isEmpty()) {
                    log.debug("Skipping membership of user={} in missing tenant={}", userId, membership.tenantId());
                    continue;
                }
                views.add(new TenantMembershipView(tenant.get(), membership.roles(), membership.joinedAt(),
                        companiesIn(membership.tenantId(), companyMemberships)));
            }
            views.sort(Comparator.comparing((TenantMembershipView v) -> v.tenant().name())
                    .thenComparing(v -> v.tenant().id()));
            return views;
        }));
    }

    /**
     * Members of the tenant. Requires member-level access.
     */
    public List<TenantUser> getTenantUsers(String tenantId, String actingUserId) {
        InputValidation.requireId("tenantId", tenantId);
        return guard.run("retrieve tenant users", tenantId, () -> {
            accessValidator.requireAccess(actingUserId, tenantId, CompanyRole.MEMBER, "view tenant users");
            return store.withTenantContext(tenantId, () -> {
                requireTenant(tenantId);
                return store.listMembershipsForTenant(tenantId).stream()
                        .map(m -> new TenantUser(m.userId(), tenantId,
                                store.getUser(m.userId()).map(UserAccount::email).orElse(null),
                                m.roles(), m.joinedAt()))
                        .sorted(Comparator.comparing(TenantUser::joinedAt).thenComparing(TenantUser::userId))
                        .toList();
            });
        });
    }

    /**
     * Member and company counts plus billing state. Requires admin-level access.
     */
    public TenantStatistics getTenantStatistics(String tenantId, String actingUserId) {
        InputValidation.requireId("tenantId", tenantId);
        return guard.run("retrieve tenant statistics", tenantId, () -> {
            accessValidator.requireAccess(actingUserId, tenantId, CompanyRole.ADMIN, "view tenant statistics");
            return store.withTenantContext(tenantId, () -> {
                Tenant tenant = requireTenant(tenantId);
                Optional<BillingSettings> billing = store.getBillingSettings(tenantId);
                return new TenantStatistics(
                        store.countMembers(tenantId),
                        store.countCompanies(tenantId),
                        billing.map(b -> b.status().value()).orElse(TenantStatistics.UNKNOWN_STATUS),
                        billing.map(BillingSettings::plan).orElse(BillingSettings.DEFAULT_PLAN),
                        tenant.createdAt());
            });
        });
    }

    /**
     * Non-throwing access check for gating UI and API calls. A null {@code minRole} only asks
     * for membership.
     */
    public boolean validateTenantAccess(String userId, String tenantId, CompanyRole minRole) {
        return accessValidator.validateTenantAccess(userId, tenantId, minRole);
    }

    public boolean validateTenantAccess(String userId, String tenantId) {
        return validateTenantAccess(userId, tenantId, null);
    }

    /**
     * Whether the user is the tenant's one and only owner; counts the same way the removal
     * and demotion checks do.
     */
    public boolean isOnlyTenantOwner(String userId, String tenantId) {
        InputValidation.requireId("userId", userId);
        InputValidation.requireId("tenantId", tenantId);
        return guard.run("check tenant ownership", tenantId,
                () -> store.withTenantContext(tenantId, () -> ownershipEnforcer.isOnlyTenantOwner(userId, tenantId)));
    }

    // ── Tenant lifecycle ──

    /**
     * Creates a tenant. When {@code creatorId} is given, the creator becomes its owner in the
     * same transaction. A null {@code billing} leaves the tenant without a billing record.
     */
    public Tenant createTenant(String name, String creatorId, BillingSettings billing) {
        String validName = InputValidation.requireName("name", name);
        return guard.run("create tenant", null, () -> store.withoutTenantContext(() -> store.inTransaction(() -> {
            if (creatorId != null && store.getUser(creatorId).isEmpty()) {
                throw new UserNotFoundException(creatorId, null);
            }
            Tenant tenant = store.insertTenant(validName);
            store.withTenantContext(tenant.id(), () -> {
                if (billing != null) {
                    store.saveBillingSettings(tenant.id(), billing);
                }
                if (creatorId != null) {
                    store.insertMembership(tenant.id(), creatorId, TenantRoles.of(TenantRoles.OWNER));
                }
                return null;
            });
            log.info("Created tenant id={} name='{}' creator={}", tenant.id(), tenant.name(), creatorId);
            return tenant;
        })));
    }

    public Tenant createTenant(String name, String creatorId) {
        return createTenant(name, creatorId, null);
    }

    /**
     * Renames the tenant and/or merges billing fields. Requires admin-level access.
     */
    public Tenant updateTenant(String tenantId, TenantPatch patch, String actingUserId) {
        InputValidation.requireId("tenantId", tenantId);
        Objects.requireNonNull(patch, "patch");
        String newName = patch.name() == null ? null : InputValidation.requireName("name", patch.name());
        return guard.run("update tenant", tenantId, () -> underTenantLock(tenantId, () -> {
            accessValidator.requireAccess(actingUserId, tenantId, CompanyRole.ADMIN, "update tenant");
            Tenant tenant = requireTenant(tenantId);
            if (newName != null) {
                tenant = store.updateTenantName(tenantId, newName)
                        .orElseThrow(() -> new TenantNotFoundException(tenantId));
            }
            if (patch.billing() != null && !patch.billing().isEmpty()) {
                BillingSettings merged = store.getBillingSettings(tenantId)
                        .orElseGet(BillingSettings::defaults)
                        .merge(patch.billing());
                store.saveBillingSettings(tenantId, merged);
                if (newName == null) {
                    store.touchTenant(tenantId);
                    tenant = requireTenant(tenantId);
                }
            }
            return tenant;
        }));
    }

    // ── Membership ──

    /**
     * Adds the user to the tenant, or replaces the labels of an existing membership. Calling it
     * twice with the same arguments leaves one membership row. An empty label set means
     * {@code member}. Requires admin-level access.
     */
    public TenantMembership addUserToTenant(String userId, String tenantId, TenantRoles roles, String actingUserId) {
        InputValidation.requireId("userId", userId);
        InputValidation.requireId("tenantId", tenantId);
        TenantRoles effectiveRoles = roles == null || roles.isEmpty() ? TenantRoles.of(TenantRoles.MEMBER) : roles;
        return guard.run("add user to tenant", tenantId, () -> underTenantLock(tenantId, () -> {
            EffectiveRole caller = accessValidator.requireAccess(
                    actingUserId, tenantId, CompanyRole.ADMIN, "add users");
            if (store.getUser(userId).isEmpty()) {
                throw new UserNotFoundException(userId, tenantId);
            }
            requireTenant(tenantId);
            Optional<TenantMembership> existing = store.getMembership(tenantId, userId);
            if (existing.isEmpty()) {
                if (effectiveRoles.isOwner()) {
                    requireOwnerCaller(caller, actingUserId, tenantId, "grant the owner role");
                }
                store.insertMembership(tenantId, userId, effectiveRoles);
                log.info("Added user={} to tenant={} roles={}", userId, tenantId, effectiveRoles.labels());
            } else if (!existing.get().roles().equals(effectiveRoles)) {
                replaceRoles(existing.get(), effectiveRoles, caller, actingUserId);
            }
            return store.getMembership(tenantId, userId).orElseThrow();
        }));
    }

    /**
     * Removes the user from the tenant together with all of the user's company memberships in
     * it. Refused when the user is the tenant's last owner. Requires admin-level access, and
     * owner-level access to remove an owner.
     */
    public void removeUserFromTenant(String userId, String tenantId, String actingUserId) {
        InputValidation.requireId("userId", userId);
        InputValidation.requireId("tenantId", tenantId);
        guard.runVoid("remove user from tenant", tenantId, () -> underTenantLock(tenantId, () -> {
            EffectiveRole caller = accessValidator.requireAccess(
                    actingUserId, tenantId, CompanyRole.ADMIN, "remove users");
            requireTenant(tenantId);
            store.getMembership(tenantId, userId)
                    .orElseThrow(() -> MembershipNotFoundException.ofTenant(userId, tenantId));
            if (holdsOwnership(tenantId, userId)) {
                requireOwnerCaller(caller, actingUserId, tenantId, "remove an owner");
            }
            ownershipEnforcer.checkRemoval(tenantId, userId, actingUserId);
            int companies = store.deleteCompanyMembershipsForUser(tenantId, userId);
            store.deleteMembership(tenantId, userId);
            log.info("Removed user={} from tenant={} ({} company memberships)", userId, tenantId, companies);
            return null;
        }));
    }

    /**
     * Overwrites the user's tenant labels. Refused when it strips the last owner. Requires
     * admin-level access, and owner-level access when the owner label changes hands.
     */
    public TenantMembership updateUserTenantRoles(
            String userId, String tenantId, TenantRoles roles, String actingUserId) {
        InputValidation.requireId("userId", userId);
        InputValidation.requireId("tenantId", tenantId);
        if (roles == null || roles.isEmpty()) {
            throw new TenantValidationException("roles", "At least one role is required");
        }
        return guard.run("update user tenant roles", tenantId, () -> underTenantLock(tenantId, () -> {
            EffectiveRole caller = accessValidator.requireAccess(
                    actingUserId, tenantId, CompanyRole.ADMIN, "update user roles");
            requireTenant(tenantId);
            TenantMembership existing = store.getMembership(tenantId, userId)
                    .orElseThrow(() -> MembershipNotFoundException.ofTenant(userId, tenantId));
            replaceRoles(existing, roles, caller, actingUserId);
            return store.getMembership(tenantId, userId).orElseThrow();
        }));
    }

    // ── Context switching ──

    /**
     * Runs {@code work} with store queries scoped to the tenant and the tenant bound to the
     * logging context. Errors of {@code work} propagate unchanged.
     */
    public <T> T withTenantContext(String tenantId, Supplier<T> work) {
        InputValidation.requireId("tenantId", tenantId);
        return store.withTenantContext(tenantId, () -> CorrelationContextHolder.callInTenant(tenantId, work));
    }

    /**
     * Runs {@code work} with tenant scoping lifted.
     */
    public <T> T withoutTenantContext(Supplier<T> work) {
        return store.withoutTenantContext(work);
    }

    // ── Internals ──

    private void replaceRoles(TenantMembership existing, TenantRoles roles, EffectiveRole caller, String actingUserId) {
        String tenantId = existing.tenantId();
        if (existing.roles().isOwner() != roles.isOwner()) {
            requireOwnerCaller(caller, actingUserId, tenantId,
                    roles.isOwner() ? "grant the owner role" : "revoke the owner role");
        }
        ownershipEnforcer.checkTenantRoleChange(tenantId, existing.userId(), roles);
        store.updateMembershipRoles(tenantId, existing.userId(), roles);
        log.info("Updated roles of user={} in tenant={}: {} -> {}",
                existing.userId(), tenantId, existing.roles().labels(), roles.labels());
    }

    private boolean holdsOwnership(String tenantId, String userId) {
        boolean tenantOwner = store.getMembership(tenantId, userId).map(m -> m.roles().isOwner()).orElse(false);
        return tenantOwner || store.listCompanyMembershipsForTenant(tenantId).stream()
                .anyMatch(m -> m.userId().equals(userId) && m.role() == CompanyRole.OWNER);
    }

    private static void requireOwnerCaller(EffectiveRole caller, String actingUserId, String tenantId, String action) {
        if (!caller.satisfies(CompanyRole.OWNER)) {
            throw new TenantAccessException("Insufficient permissions to " + action,
                    tenantId, actingUserId, CompanyRole.OWNER, caller.role());
        }
    }

    private Tenant requireTenant(String tenantId) {
        return store.getTenant(tenantId).orElseThrow(() -> new TenantNotFoundException(tenantId));
    }

    /**
     * Runs {@code work} in a tenant-scoped transaction that takes the tenant lock first. The
     * caller's role must be resolved inside {@code work}, so a concurrent demotion is seen.
     */
    private <T> T underTenantLock(String tenantId, Supplier<T> work) {
        return store.withTenantContext(tenantId, () -> store.inTransaction(() -> {
            store.lockTenant(tenantId);
            return work.get();
        }));
    }

    private List<CompanyMembershipView> companiesIn(String tenantId, List<CompanyMembership> memberships) {
        List<CompanyMembershipView> companies = new ArrayList<>();
        for (CompanyMembership membership : memberships) {
            if (!tenantId.equals(membership.tenantId())) {
                continue;
            }
            store.getCompany(membership.companyId())
                    .filter(c -> tenantId.equals(c.tenantId()))
                    .map(Company::name)
                    .ifPresent(name -> companies.add(
                            new CompanyMembershipView(membership.companyId(), name, membership.role())));
        }
        companies.sort(Comparator.comparing(CompanyMembershipView::name));
        return companies;
    }
}
