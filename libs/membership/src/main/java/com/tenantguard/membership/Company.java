package com.tenantguard.membership;

import java.time.Instant;

/**
 * Organizational unit inside a tenant. {@code tenantId} never changes after creation.
 *
 * @param id        company identifier
 * @param tenantId  owning tenant
 * @param name      display name
 * @param createdAt creation time
 */
public record Company(String id, String tenantId, String name, Instant createdAt) {}
