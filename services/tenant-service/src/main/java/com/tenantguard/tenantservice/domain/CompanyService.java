package com.tenantguard.tenantservice.domain;

import com.tenantguard.authorization.AccessValidator;
import com.tenantguard.authorization.CompanyNotFoundException;
import com.tenantguard.authorization.EffectiveRole;
import com.tenantguard.authorization.MembershipNotFoundException;
import com.tenantguard.authorization.OwnershipInvariantEnforcer;
import com.tenantguard.authorization.OwnershipInvariantException;
import com.tenantguard.authorization.TenantAccessException;
import com.tenantguard.authorization.TenantIsolationEnforcer;
import com.tenantguard.authorization.TenantNotFoundException;
import com.tenantguard.membership.Company;
import com.tenantguard.membership.CompanyMembership;
import com.tenantguard.membership.CompanyRole;
import com.tenantguard.membership.MembershipStore;
import com.tenantguard.membership.StoreException;
import com.tenantguard.membership.UserAccount;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Company management inside a tenant.
 *
 * <p>Company-scoped checks need tenant membership first; the caller's company role then applies
 * when one exists and the tenant role otherwise. Every company read or write verifies that the
 * company belongs to the addressed tenant. Writes run under the tenant lock, with the caller's
 * role resolved after the lock is taken, like {@link TenantService}, so company demotions and
 * removals are covered by the same ownership invariant.
 */
public class CompanyService {

    private static final Logger log = LoggerFactory.getLogger(CompanyService.class);

    private final MembershipStore store;
    private final AccessValidator accessValidator;
    private final OwnershipInvariantEnforcer ownershipEnforcer;
    private final OperationGuard guard;

    public CompanyService(
            MembershipStore store,
            AccessValidator accessValidator,
            OwnershipInvariantEnforcer ownershipEnforcer,
            OperationGuard guard) {
        this.store = Objects.requireNonNull(store, "store");
        this.accessValidator = Objects.requireNonNull(accessValidator, "accessValidator");
        this.ownershipEnforcer = Objects.requireNonNull(ownershipEnforcer, "ownershipEnforcer");
        this.guard = Objects.requireNonNull(guard, "guard");
    }

    // ── Companies ──

    /** Requires tenant admin. */
    public Company createCompany(String tenantId, String name, String actingUserId) {
        InputValidation.requireId("tenantId", tenantId);
        String validName = InputValidation.requireName("name", name);
        return guard.run("create company", tenantId, () -> underTenantLock(tenantId, () -> {
            accessValidator.requireAccess(actingUserId, tenantId, CompanyRole.ADMIN, "create company");
            requireTenant(tenantId);
            Company company = store.insertCompany(tenantId, validName);
            log.info("Created company id={} in tenant={}", company.id(), tenantId);
            return company;
        }));
    }

    /**
     * The company, or empty when it does not exist inside the tenant. Requires company-scoped
     * member access.
     */
    public Optional<Company> getCompanyById(String tenantId, String companyId, String actingUserId) {
        InputValidation.requireId("tenantId", tenantId);
        InputValidation.requireId("companyId", companyId);
        return guard.run("retrieve company", tenantId, () -> {
            accessValidator.requireAccess(actingUserId, tenantId, CompanyRole.MEMBER, companyId, "view company");
            return store.withTenantContext(tenantId, () -> store.getCompany(companyId)
                    .filter(company -> tenantId.equals(company.tenantId())));
        });
    }

    /**
     * Renames the company. Its tenant never changes. Requires company-scoped admin.
     */
    public Company updateCompany(String tenantId, String companyId, String name, String actingUserId) {
        InputValidation.requireId("tenantId", tenantId);
        InputValidation.requireId("companyId", companyId);
        String validName = InputValidation.requireName("name", name);
        return guard.run("update company", tenantId, () -> underTenantLock(tenantId, () -> {
            accessValidator.requireAccess(actingUserId, tenantId, CompanyRole.ADMIN, companyId, "update company");
            requireCompany(tenantId, companyId);
            Company updated = store.updateCompanyName(companyId, validName)
                    .orElseThrow(() -> new CompanyNotFoundException(companyId, tenantId));
            log.info("Renamed company id={} in tenant={}", companyId, tenantId);
            return updated;
        }));
    }

    /** Companies of the tenant ordered by name. Requires tenant membership. */
    public List<Company> getCompaniesForTenant(String tenantId, String actingUserId) {
        InputValidation.requireId("tenantId", tenantId);
        return guard.run("retrieve companies", tenantId, () -> {
            accessValidator.requireAccess(actingUserId, tenantId, CompanyRole.MEMBER, "view companies");
            return store.withTenantContext(tenantId, () -> {
                requireTenant(tenantId);
                return store.listCompaniesForTenant(tenantId).stream()
                        .sorted(Comparator.comparing(Company::name).thenComparing(Company::id))
                        .toList();
            });
        });
    }

    /**
     * Every company the user belongs to, across tenants, ordered by company name. Users may
     * only list their own companies unless the caller is staff.
     */
    public List<UserCompany> getUserCompanies(String userId, String actingUserId) {
        InputValidation.requireId("userId", userId);
        return guard.run("retrieve user companies", null, () -> {
            boolean self = userId.equals(actingUserId);
            if (!self && (actingUserId == null || !accessValidator.isStaff(actingUserId))) {
                throw new TenantAccessException("Can only view your own companies",
                        null, actingUserId, null, null);
            }
            return store.withoutTenantContext(() -> {
                List<UserCompany> companies = new ArrayList<>();
                for (CompanyMembership membership : store.listCompanyMembershipsForUser(userId)) {
                    store.getCompany(membership.companyId())
                            .filter(company -> company.tenantId().equals(membership.tenantId()))
                            .ifPresent(company -> companies.add(
                                    new UserCompany(company, membership.role(), membership.joinedAt())));
                }
                companies.sort(Comparator.comparing((UserCompany c) -> c.company().name())
                        .thenComparing(c -> c.company().id()));
                return companies;
            });
        });
    }

    /**
     * Members of the company, owners first, then by email. Requires company-scoped member access.
     */
    public List<CompanyUser> getCompanyUsers(String tenantId, String companyId, String actingUserId) {
        InputValidation.requireId("tenantId", tenantId);
        InputValidation.requireId("companyId", companyId);
        return guard.run("retrieve company users", tenantId, () -> {
            accessValidator.requireAccess(
                    actingUserId, tenantId, CompanyRole.MEMBER, companyId, "view company users");
            return store.withTenantContext(tenantId, () -> {
                requireCompany(tenantId, companyId);
                return companyMembers(tenantId, companyId).stream()
                        .map(m -> new CompanyUser(m.userId(), tenantId, companyId,
                                store.getUser(m.userId()).map(UserAccount::email).orElse(null),
                                m.role(), m.joinedAt()))
                        .sorted(Comparator.comparing(CompanyUser::role).reversed()
                                .thenComparing(CompanyUser::email, Comparator.nullsLast(Comparator.naturalOrder()))
                                .thenComparing(CompanyUser::userId))
                        .toList();
            });
        });
    }

    /**
     * Member and role counts of the company. Requires company-scoped member access.
     */
    public CompanyStatistics getCompanyStatistics(String tenantId, String companyId, String actingUserId) {
        InputValidation.requireId("tenantId", tenantId);
        InputValidation.requireId("companyId", companyId);
        return guard.run("retrieve company statistics", tenantId, () -> {
            accessValidator.requireAccess(
                    actingUserId, tenantId, CompanyRole.MEMBER, companyId, "view company statistics");
            return store.withTenantContext(tenantId, () -> {
                Company company = requireCompany(tenantId, companyId);
                List<CompanyMembership> members = companyMembers(tenantId, companyId);
                return new CompanyStatistics(
                        members.size(),
                        (int) members.stream().filter(m -> m.role() == CompanyRole.ADMIN).count(),
                        (int) members.stream().filter(m -> m.role() == CompanyRole.OWNER).count(),
                        company.createdAt(),
                        members.stream().map(CompanyMembership::joinedAt).max(Comparator.naturalOrder()).orElse(null));
            });
        });
    }

    /**
     * Non-throwing company access check. False when the company is not part of the tenant or
     * the store fails. A null {@code minRole} only asks for membership.
     */
    public boolean validateCompanyAccess(String userId, String tenantId, String companyId, CompanyRole minRole) {
        if (!accessValidator.validateCompanyAccess(userId, tenantId, companyId, minRole)) {
            return false;
        }
        try {
            return store.withTenantContext(tenantId, () -> store.getCompany(companyId))
                    .filter(company -> tenantId.equals(company.tenantId()))
                    .isPresent();
        } catch (StoreException e) {
            log.warn("Company lookup for access validation failed, denying: {}", e.toString());
            return false;
        }
    }

    // ── Company membership ──

    /**
     * Adds a tenant member to the company, or changes the role of an existing company
     * membership. Requires company-scoped admin, and owner-level access to grant or take away
     * {@link CompanyRole#OWNER}.
     */
    public CompanyMembership addUserToCompany(
            String userId, String tenantId, String companyId, CompanyRole role, String actingUserId) {
        InputValidation.requireId("userId", userId);
        InputValidation.requireId("tenantId", tenantId);
        InputValidation.requireId("companyId", companyId);
        CompanyRole effectiveRole = role == null ? CompanyRole.MEMBER : role;
        return guard.run("add user to company", tenantId, () -> underTenantLock(tenantId, () -> {
            EffectiveRole caller = accessValidator.requireAccess(
                    actingUserId, tenantId, CompanyRole.ADMIN, companyId, "add users");
            requireCompany(tenantId, companyId);
            if (store.getMembership(tenantId, userId).isEmpty()) {
                throw new TenantAccessException("User does not have access to this tenant",
                        tenantId, userId, CompanyRole.MEMBER, null);
            }
            Optional<CompanyMembership> existing = store.getCompanyMembership(companyId, userId);
            if (existing.isEmpty()) {
                if (effectiveRole == CompanyRole.OWNER) {
                    requireOwnerCaller(caller, actingUserId, tenantId, "grant the owner role");
                }
                store.insertCompanyMembership(tenantId, companyId, userId, effectiveRole);
                log.info("Added user={} to company={} role={}", userId, companyId, effectiveRole.label());
            } else if (existing.get().role() != effectiveRole) {
                changeRole(existing.get(), effectiveRole, caller, actingUserId);
            }
            return store.getCompanyMembership(companyId, userId).orElseThrow();
        }));
    }

    /**
     * Changes the role of an existing company membership. Refused when it strips the tenant's
     * last owner.
     */
    public CompanyMembership updateUserCompanyRole(
            String userId, String tenantId, String companyId, CompanyRole role, String actingUserId) {
        InputValidation.requireId("userId", userId);
        InputValidation.requireId("tenantId", tenantId);
        InputValidation.requireId("companyId", companyId);
        Objects.requireNonNull(role, "role");
        return guard.run("update user company role", tenantId, () -> underTenantLock(tenantId, () -> {
            EffectiveRole caller = accessValidator.requireAccess(
                    actingUserId, tenantId, CompanyRole.ADMIN, companyId, "update user roles");
            requireCompany(tenantId, companyId);
            CompanyMembership existing = store.getCompanyMembership(companyId, userId)
                    .orElseThrow(() -> MembershipNotFoundException.ofCompany(userId, tenantId, companyId));
            if (existing.role() != role) {
                changeRole(existing, role, caller, actingUserId);
            }
            return store.getCompanyMembership(companyId, userId).orElseThrow();
        }));
    }

    /**
     * Removes the user from the company. Refused for the company's only owner and for the
     * tenant's last owner.
     */
    public void removeUserFromCompany(String userId, String tenantId, String companyId, String actingUserId) {
        InputValidation.requireId("userId", userId);
        InputValidation.requireId("tenantId", tenantId);
        InputValidation.requireId("companyId", companyId);
        guard.runVoid("remove user from company", tenantId, () -> underTenantLock(tenantId, () -> {
            EffectiveRole caller = accessValidator.requireAccess(
                    actingUserId, tenantId, CompanyRole.ADMIN, companyId, "remove users");
            requireCompany(tenantId, companyId);
            CompanyMembership existing = store.getCompanyMembership(companyId, userId)
                    .orElseThrow(() -> MembershipNotFoundException.ofCompany(userId, tenantId, companyId));
            if (existing.role() == CompanyRole.OWNER) {
                requireOwnerCaller(caller, actingUserId, tenantId, "remove an owner");
                if (ownershipEnforcer.isOnlyCompanyOwner(userId, tenantId, companyId)) {
                    throw new OwnershipInvariantException(
                            "Cannot remove the only owner of the company", tenantId, userId);
                }
            }
            ownershipEnforcer.checkCompanyRoleChange(tenantId, companyId, userId, null);
            store.deleteCompanyMembership(companyId, userId);
            log.info("Removed user={} from company={}", userId, companyId);
            return null;
        }));
    }

    /** Whether the user is the one and only owner of the company. */
    public boolean isOnlyCompanyOwner(String userId, String tenantId, String companyId) {
        InputValidation.requireId("userId", userId);
        InputValidation.requireId("tenantId", tenantId);
        InputValidation.requireId("companyId", companyId);
        return guard.run("check company ownership", tenantId, () -> store.withTenantContext(tenantId,
                () -> ownershipEnforcer.isOnlyCompanyOwner(userId, tenantId, companyId)));
    }

    // ── Internals ──

    private void changeRole(CompanyMembership existing, CompanyRole role, EffectiveRole caller, String actingUserId) {
        String tenantId = existing.tenantId();
        if (existing.role() == CompanyRole.OWNER || role == CompanyRole.OWNER) {
            requireOwnerCaller(caller, actingUserId, tenantId,
                    role == CompanyRole.OWNER ? "grant the owner role" : "revoke the owner role");
        }
        ownershipEnforcer.checkCompanyRoleChange(tenantId, existing.companyId(), existing.userId(), role);
        store.updateCompanyMembershipRole(existing.companyId(), existing.userId(), role);
        log.info("Changed role of user={} in company={}: {} -> {}",
                existing.userId(), existing.companyId(), existing.role().label(), role.label());
    }

    private List<CompanyMembership> companyMembers(String tenantId, String companyId) {
        return store.listCompanyMembershipsForTenant(tenantId).stream()
                .filter(m -> companyId.equals(m.companyId()))
                .toList();
    }

    private Company requireCompany(String tenantId, String companyId) {
        requireTenant(tenantId);
        Company company = store.withoutTenantContext(() -> store.getCompany(companyId))
                .orElseThrow(() -> new CompanyNotFoundException(companyId, tenantId));
        TenantIsolationEnforcer.enforce(tenantId, company);
        return company;
    }

    private void requireTenant(String tenantId) {
        if (store.getTenant(tenantId).isEmpty()) {
            throw new TenantNotFoundException(tenantId);
        }
    }

    private static void requireOwnerCaller(EffectiveRole caller, String actingUserId, String tenantId, String action) {
        if (!caller.satisfies(CompanyRole.OWNER)) {
            throw new TenantAccessException("Insufficient permissions to " + action,
                    tenantId, actingUserId, CompanyRole.OWNER, caller.role());
        }
    }

    /**
     * Tenant-scoped transaction that takes the tenant lock before {@code work} resolves the
     * caller's role.
     */
    private <T> T underTenantLock(String tenantId, Supplier<T> work) {
        return store.withTenantContext(tenantId, () -> store.inTransaction(() -> {
            store.lockTenant(tenantId);
            return work.get();
        }));
    }
}
