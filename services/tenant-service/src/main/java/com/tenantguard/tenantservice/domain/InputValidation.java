package com.tenantguard.tenantservice.domain;

import com.tenantguard.authorization.TenantValidationException;
import com.tenantguard.membership.TenantRoles;
import java.util.Collection;

/**
 * Input checks shared by the facades.
 */
public final class InputValidation {

    static final int MAX_NAME_LENGTH = 255;

    private InputValidation() {
        // utility class
    }

    static String requireId(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new TenantValidationException(field, field + " must not be blank");
        }
        return value;
    }

    static String requireName(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new TenantValidationException(field, field + " must not be blank");
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new TenantValidationException(field,
                    "%s must be at most %d characters".formatted(field, MAX_NAME_LENGTH));
        }
        return trimmed;
    }

    /**
     * Builds a role set from caller-supplied labels, reporting the first bad label against {@code field}.
     * A null collection means no roles.
     */
    public static TenantRoles requireRoles(String field, Collection<String> labels) {
        if (labels == null) {
            return TenantRoles.none();
        }
        for (String label : labels) {
            if (label == null || !TenantRoles.isValidLabel(label)) {
                throw new TenantValidationException(field, "Invalid role label: '%s'".formatted(label));
            }
        }
        return TenantRoles.of(labels);
    }
}
