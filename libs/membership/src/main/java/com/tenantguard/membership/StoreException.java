package com.tenantguard.membership;

/**
 * Wraps any failure of the underlying persistence layer.
 * <p>
 * Store failures are transient from the caller's point of view and the only
 * error class eligible for caller-driven retry. The message is meant for logs;
 * it is never shown to end users.
 */
public class StoreException extends RuntimeException {

    private final String operation;

    public StoreException(String operation, Throwable cause) {
        super("Membership store operation '%s' failed".formatted(operation), cause);
        this.operation = operation;
    }

    public StoreException(String operation, String message) {
        super("Membership store operation '%s' failed: %s".formatted(operation, message));
        this.operation = operation;
    }

    /** Name of the store operation that failed (e.g., "insertMembership"). */
    public String operation() {
        return operation;
    }
}
