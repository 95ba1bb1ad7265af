package com.tenantguard.authorization;

import com.tenantguard.membership.CompanyRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Compares a user's effective role against a required minimum role.
 * <p>
 * Stateless and free of mutation, so it is safe to call from any number of threads without
 * locking. {@link #validateTenantAccess} is the read-only variant for callers gating UI or API
 * calls and never throws; {@link #requireAccess} is the assertive variant used internally.
 */
public final class AccessValidator {

    private static final Logger log = LoggerFactory.getLogger(AccessValidator.class);

    private final RoleResolver roleResolver;

    public AccessValidator(RoleResolver roleResolver) {
        this.roleResolver = Objects.requireNonNull(roleResolver, "roleResolver");
    }

    /**
     * Tenant-scoped access check.
     */
    public boolean hasAccess(String userId, String tenantId, CompanyRole minRole) {
        return hasAccess(userId, tenantId, minRole, null);
    }

    /**
     * Checks whether the user's effective role for the tenant (or the company inside it)
     * is at least {@code minRole}. Store failures propagate.
     */
    public boolean hasAccess(String userId, String tenantId, CompanyRole minRole, String companyId) {
        Objects.requireNonNull(minRole, "minRole");
        return roleResolver.resolveEffectiveRole(userId, tenantId, companyId)
                .map(role -> role.satisfies(minRole))
                .orElse(false);
    }

    /**
     * Non-throwing check. A null {@code minRole} only asks for membership. Any failure,
     * including store errors and malformed ids, yields false.
     */
    public boolean validateTenantAccess(String userId, String tenantId, CompanyRole minRole) {
        if (isBlank(userId) || isBlank(tenantId)) {
            return false;
        }
        try {
            return hasAccess(userId, tenantId, minRole == null ? CompanyRole.MEMBER : minRole);
        } catch (RuntimeException e) {
            log.warn("Access validation for user={} tenant={} failed, denying: {}", userId, tenantId, e.toString());
            return false;
        }
    }

    /**
     * Non-throwing check for a company inside a tenant. Requires tenant membership; the company
     * role, or the tenant role without one, must reach {@code minRole} (member when null).
     */
    public boolean validateCompanyAccess(String userId, String tenantId, String companyId, CompanyRole minRole) {
        if (isBlank(userId) || isBlank(tenantId) || isBlank(companyId)) {
            return false;
        }
        try {
            return hasAccess(userId, tenantId, minRole == null ? CompanyRole.MEMBER : minRole, companyId);
        } catch (RuntimeException e) {
            log.warn("Company access validation for user={} tenant={} company={} failed, denying: {}",
                    userId, tenantId, companyId, e.toString());
            return false;
        }
    }

    /**
     * Whether the user is staff.
     */
    public boolean isStaff(String userId) {
        return roleResolver.isStaff(userId);
    }

    /**
     * Tenant-scoped assertive check.
     *
     * @return the effective role that satisfied the check
     * @throws TenantAccessException when the effective role is missing or too low
     */
    public EffectiveRole requireAccess(String userId, String tenantId, CompanyRole minRole, String action) {
        return requireAccess(userId, tenantId, minRole, null, action);
    }

    /**
     * Assertive check for a company inside a tenant ({@code companyId} may be null).
     *
     * @param action short description used in the error message, e.g. "update tenant"
     * @return the effective role that satisfied the check
     * @throws TenantAccessException when the effective role is missing or too low
     */
    public EffectiveRole requireAccess(String userId, String tenantId, CompanyRole minRole,
                                       String companyId, String action) {
        Optional<EffectiveRole> role = roleResolver.resolveEffectiveRole(userId, tenantId, companyId);
        if (role.isPresent() && role.get().satisfies(minRole)) {
            return role.get();
        }
        CompanyRole actual = role.map(EffectiveRole::role).orElse(null);
        log.debug("Access denied: user={} tenant={} company={} required={} actual={}",
                userId, tenantId, companyId, minRole, actual);
        throw new TenantAccessException("Insufficient permissions to " + action, tenantId, userId, minRole, actual);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
