package com.tenantguard.authorization;

import com.tenantguard.membership.CompanyRole;

/**
 * The acting user's effective role is below what the operation requires.
 */
public class TenantAccessException extends TenantException {

    private final String userId;
    private final CompanyRole requiredRole;
    private final CompanyRole actualRole;

    public TenantAccessException(String message, String tenantId, String userId,
                                 CompanyRole requiredRole, CompanyRole actualRole) {
        super(ErrorKind.ACCESS_DENIED, message, tenantId);
        this.userId = userId;
        this.requiredRole = requiredRole;
        this.actualRole = actualRole;
    }

    public String userId() {
        return userId;
    }

    public CompanyRole requiredRole() {
        return requiredRole;
    }

    /** The role the user actually holds; null when the user has no access at all. */
    public CompanyRole actualRole() {
        return actualRole;
    }
}
