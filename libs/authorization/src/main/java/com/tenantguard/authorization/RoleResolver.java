package com.tenantguard.authorization;

import com.tenantguard.membership.CompanyRole;
import com.tenantguard.membership.MembershipStore;
import com.tenantguard.membership.TenantMembership;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Computes the effective role of a user for a tenant, or for a company inside it.
 * <p>
 * Resolution order:
 * <ol>
 *   <li>Staff users resolve to {@link CompanyRole#OWNER} immediately. This is the only place the
 *       staff flag is consulted; every bypass is written to the {@code tenantguard.audit} log.</li>
 *   <li>Tenant scope (no company given): the tenant membership row is authoritative. A row grants
 *       at least {@code member}; the hierarchical labels raise it. Company rows are ignored.</li>
 *   <li>Company scope: tenant membership is required first, so a company row alone grants
 *       nothing. The company membership row then governs when one exists; otherwise the tenant
 *       role applies. A company row whose company belongs to another tenant is ignored.</li>
 * </ol>
 * Absence of any applicable row resolves to empty, which means "no access".
 */
public final class RoleResolver {

    private static final Logger log = LoggerFactory.getLogger(RoleResolver.class);
    private static final Logger audit = LoggerFactory.getLogger("tenantguard.audit");

    private final MembershipStore store;
    private final StaffDirectory staffDirectory;

    public RoleResolver(MembershipStore store, StaffDirectory staffDirectory) {
        this.store = Objects.requireNonNull(store, "store");
        this.staffDirectory = Objects.requireNonNull(staffDirectory, "staffDirectory");
    }

    /**
     * Resolves the tenant-scoped effective role.
     */
    public Optional<EffectiveRole> resolveEffectiveRole(String userId, String tenantId) {
        return resolveEffectiveRole(userId, tenantId, null);
    }

    /**
     * Resolves the effective role for {@code companyId} inside {@code tenantId}, or the
     * tenant-scoped role when {@code companyId} is null.
     */
    public Optional<EffectiveRole> resolveEffectiveRole(String userId, String tenantId, String companyId) {
        if (staffDirectory.isStaff(userId)) {
            audit.info("Staff bypass: user={} tenant={} company={}", userId, tenantId, companyId);
            return Optional.of(EffectiveRole.staff());
        }

        Optional<EffectiveRole> tenantRole = store.getMembership(tenantId, userId).map(RoleResolver::tenantRole);
        if (companyId == null) {
            return tenantRole;
        }
        if (tenantRole.isEmpty()) {
            log.debug("Ignoring company rows of user={} company={}: not a member of tenant={}",
                    userId, companyId, tenantId);
            return Optional.empty();
        }

        Optional<EffectiveRole> companyRole = store.getCompanyMembership(companyId, userId)
                .filter(m -> tenantId.equals(m.tenantId()))
                .map(m -> new EffectiveRole(m.role(), RoleSource.COMPANY));
        if (companyRole.isPresent()) {
            return companyRole;
        }
        log.debug("No company membership for user={} company={}, falling back to tenant role", userId, companyId);
        return tenantRole;
    }

    /**
     * Whether the user is flagged as staff.
     */
    public boolean isStaff(String userId) {
        return staffDirectory.isStaff(userId);
    }

    private static EffectiveRole tenantRole(TenantMembership membership) {
        CompanyRole role = membership.roles().highestHierarchical().orElse(CompanyRole.MEMBER);
        return new EffectiveRole(role, RoleSource.TENANT);
    }
}
