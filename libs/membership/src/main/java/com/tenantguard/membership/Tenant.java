package com.tenantguard.membership;

import java.time.Instant;

/**
 * Top-level isolation boundary for a customer account.
 *
 * @param id        tenant identifier
 * @param name      display name
 * @param createdAt creation time
 * @param updatedAt last modification time (equal to {@code createdAt} until first update)
 */
public record Tenant(String id, String name, Instant createdAt, Instant updatedAt) {}
