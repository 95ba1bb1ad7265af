package com.tenantguard.authorization.isolation;

/**
 * Kinds of data-integrity problems the isolation checker detects.
 */
public enum ViolationType {

    NULL_TENANT("row has a null tenant identifier"),
    MISSING_TENANT("row references a tenant that does not exist"),
    MISSING_USER("membership references a user that does not exist"),
    MISSING_COMPANY("membership references a company that does not exist"),
    TENANT_MISMATCH("membership tenant differs from its company's tenant"),
    INVALID_ROLE("company membership role is not one of member, admin, owner"),
    BLANK_NAME("company has a blank name");

    private final String description;

    ViolationType(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
