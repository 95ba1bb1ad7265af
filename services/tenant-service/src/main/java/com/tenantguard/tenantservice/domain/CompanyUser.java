package com.tenantguard.tenantservice.domain;

import com.tenantguard.membership.CompanyRole;
import java.time.Instant;

/**
 * A member of a company. {@code email} is null when the identity provider no longer knows the user.
 */
public record CompanyUser(
        String userId, String tenantId, String companyId, String email, CompanyRole role, Instant joinedAt) {}
