package com.tenantguard.authorization;

/**
 * Malformed input such as a blank name or an invalid role label.
 */
public class TenantValidationException extends TenantException {

    private final String field;

    public TenantValidationException(String field, String message) {
        super(ErrorKind.VALIDATION, message, null);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
