package com.tenantguard.authorization;

/**
 * The referenced company does not exist inside the addressed tenant.
 */
public class CompanyNotFoundException extends TenantException {

    private final String companyId;

    public CompanyNotFoundException(String companyId, String tenantId) {
        super(ErrorKind.NOT_FOUND, "Company not found: %s".formatted(companyId), tenantId);
        this.companyId = companyId;
    }

    public String companyId() {
        return companyId;
    }
}
