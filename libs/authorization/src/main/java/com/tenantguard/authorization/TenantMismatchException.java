package com.tenantguard.authorization;

/**
 * Thrown when a write would attach a record of one tenant to another tenant.
 */
public class TenantMismatchException extends TenantException {

    private final String actualTenantId;

    public TenantMismatchException(String expectedTenantId, String actualTenantId) {
        super(ErrorKind.ACCESS_DENIED,
                "Tenant mismatch: tenant '%s' cannot use a resource of tenant '%s'"
                        .formatted(expectedTenantId, actualTenantId),
                expectedTenantId);
        this.actualTenantId = actualTenantId;
    }

    public String expectedTenantId() {
        return tenantId();
    }

    public String actualTenantId() {
        return actualTenantId;
    }
}
