package com.tenantguard.authorization;

/**
 * Base class of every error raised by tenant authorization and membership management.
 * <p>
 * Unchecked: callers either translate it at their boundary (HTTP, UI) or let it propagate.
 * Subclasses carry the context a caller needs to render an actionable message.
 */
public class TenantException extends RuntimeException {

    private final ErrorKind kind;
    private final String tenantId;

    public TenantException(ErrorKind kind, String message, String tenantId) {
        super(message);
        this.kind = kind;
        this.tenantId = tenantId;
    }

    public TenantException(ErrorKind kind, String message, String tenantId, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.tenantId = tenantId;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** Tenant the failed operation addressed; may be null. */
    public String tenantId() {
        return tenantId;
    }
}
