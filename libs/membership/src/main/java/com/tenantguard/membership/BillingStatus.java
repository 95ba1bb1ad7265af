package com.tenantguard.membership;

import java.util.Locale;
import java.util.Optional;

/**
 * Subscription state recorded alongside a tenant. Opaque to authorization.
 */
public enum BillingStatus {

    ACTIVE("active"),
    SUSPENDED("suspended"),
    CANCELLED("cancelled");

    private final String value;

    BillingStatus(String value) {
        this.value = value;
    }

    /** The canonical string representation. */
    public String value() {
        return value;
    }

    public static Optional<BillingStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (BillingStatus status : values()) {
            if (status.value.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
