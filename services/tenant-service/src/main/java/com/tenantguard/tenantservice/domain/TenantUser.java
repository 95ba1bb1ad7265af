package com.tenantguard.tenantservice.domain;

import com.tenantguard.membership.TenantRoles;
import java.time.Instant;

/**
 * A member of a tenant. {@code email} is null when the identity provider no longer knows the user.
 */
public record TenantUser(String userId, String tenantId, String email, TenantRoles roles, Instant joinedAt) {}
