package com.tenantguard.authorization;

/**
 * The referenced user is unknown to the identity provider.
 */
public class UserNotFoundException extends TenantException {

    private final String userId;

    public UserNotFoundException(String userId, String tenantId) {
        super(ErrorKind.NOT_FOUND, "User not found", tenantId);
        this.userId = userId;
    }

    public String userId() {
        return userId;
    }
}
