package com.tenantguard.tenantservice.domain;

import com.tenantguard.membership.Company;
import com.tenantguard.membership.CompanyRole;
import java.time.Instant;

/**
 * One company a user belongs to, across all tenants.
 */
public record UserCompany(Company company, CompanyRole role, Instant joinedAt) {}
