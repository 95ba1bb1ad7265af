package com.tenantguard.authorization;

/**
 * The operation would leave a tenant without any owner.
 */
public class OwnershipInvariantException extends TenantException {

    private final String userId;

    public OwnershipInvariantException(String message, String tenantId, String userId) {
        super(ErrorKind.INVARIANT_VIOLATION, message, tenantId);
        this.userId = userId;
    }

    /** The owner whose removal or demotion was refused. */
    public String userId() {
        return userId;
    }
}
