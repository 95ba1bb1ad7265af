package com.tenantguard.tenantservice.domain;

import com.tenantguard.membership.CompanyRole;

/**
 * A user's membership in one company, as listed under its tenant.
 */
public record CompanyMembershipView(String companyId, String name, CompanyRole role) {}
