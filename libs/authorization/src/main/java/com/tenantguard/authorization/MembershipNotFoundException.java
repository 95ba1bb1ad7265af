package com.tenantguard.authorization;

/**
 * The target user holds no membership where the operation requires one.
 */
public class MembershipNotFoundException extends TenantException {

    private final String userId;
    private final String companyId;

    private MembershipNotFoundException(String message, String userId, String tenantId, String companyId) {
        super(ErrorKind.NOT_FOUND, message, tenantId);
        this.userId = userId;
        this.companyId = companyId;
    }

    public static MembershipNotFoundException ofTenant(String userId, String tenantId) {
        return new MembershipNotFoundException("User is not a member of this tenant", userId, tenantId, null);
    }

    public static MembershipNotFoundException ofCompany(String userId, String tenantId, String companyId) {
        return new MembershipNotFoundException("User is not a member of this company", userId, tenantId, companyId);
    }

    public String userId() {
        return userId;
    }

    /** Company the membership was expected in; null for tenant memberships. */
    public String companyId() {
        return companyId;
    }
}
