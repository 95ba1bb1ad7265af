package com.tenantguard.authorization;

/**
 * The referenced tenant does not exist.
 */
public class TenantNotFoundException extends TenantException {

    public TenantNotFoundException(String tenantId) {
        super(ErrorKind.NOT_FOUND, "Tenant not found: %s".formatted(tenantId), tenantId);
    }
}
