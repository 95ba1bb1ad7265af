package com.tenantguard.authorization;

import com.tenantguard.membership.StoreException;

/**
 * A persistence failure surfaced to callers. The message is generic; the store's own
 * message stays in the cause for logs only.
 */
public class TenantStoreException extends TenantException {

    public TenantStoreException(String message, String tenantId, StoreException cause) {
        super(ErrorKind.STORE, message, tenantId, cause);
    }
}
