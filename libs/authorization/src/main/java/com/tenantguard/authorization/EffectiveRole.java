package com.tenantguard.authorization;

import com.tenantguard.membership.CompanyRole;

/**
 * The role a user effectively holds for one tenant (or one company inside it).
 *
 * @param role   role on the {@code member < admin < owner} ladder
 * @param source membership row (or staff flag) the role was derived from
 */
public record EffectiveRole(CompanyRole role, RoleSource source) {

    public static EffectiveRole staff() {
        return new EffectiveRole(CompanyRole.OWNER, RoleSource.STAFF);
    }

    public boolean satisfies(CompanyRole required) {
        return role.atLeast(required);
    }

    public boolean isStaff() {
        return source == RoleSource.STAFF;
    }
}
