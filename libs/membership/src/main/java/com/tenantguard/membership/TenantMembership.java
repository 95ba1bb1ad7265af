package com.tenantguard.membership;

import java.time.Instant;

/**
 * Tenant-level membership: a user and the set of tenant role labels they hold.
 *
 * @param tenantId tenant the membership belongs to
 * @param userId   member
 * @param roles    tenant-level role labels
 * @param joinedAt time the membership row was created
 */
public record TenantMembership(String tenantId, String userId, TenantRoles roles, Instant joinedAt) {}
