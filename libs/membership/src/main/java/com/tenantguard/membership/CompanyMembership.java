package com.tenantguard.membership;

import java.time.Instant;

/**
 * Company-level membership. {@code tenantId} always equals the company's tenant.
 *
 * @param tenantId  tenant of the company
 * @param userId    member
 * @param companyId company the role applies to
 * @param role      company role
 * @param joinedAt  time the membership row was created
 */
public record CompanyMembership(
        String tenantId,
        String userId,
        String companyId,
        CompanyRole role,
        Instant joinedAt
) {}
