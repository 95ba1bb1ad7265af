package com.tenantguard.authorization;

/**
 * Error taxonomy for tenant authorization failures.
 * <p>
 * Every kind except {@link #STORE} is a deterministic rejection and must not be retried.
 */
public enum ErrorKind {

    /** Referenced tenant, company, user or membership does not exist. */
    NOT_FOUND("NOT_FOUND", false),

    /** Caller's effective role is below the operation's minimum. */
    ACCESS_DENIED("ACCESS_DENIED", false),

    /** Operation would leave a tenant without an owner. */
    INVARIANT_VIOLATION("INVARIANT_VIOLATION", false),

    /** Malformed input: blank names, invalid role labels. */
    VALIDATION("VALIDATION_ERROR", false),

    /** Underlying persistence failure. */
    STORE("STORE_ERROR", true);

    private final String code;
    private final boolean retryable;

    ErrorKind(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    /** Stable machine-readable code exposed to callers. */
    public String code() {
        return code;
    }

    /** Whether a caller may retry the operation. */
    public boolean retryable() {
        return retryable;
    }
}
