package com.tenantguard.authorization;

/**
 * Where an effective role came from.
 */
public enum RoleSource {
    STAFF,
    TENANT,
    COMPANY
}
