package com.tenantguard.tenantservice.domain;

import java.time.Instant;

/**
 * Member counts for one company.
 *
 * @param userCount number of company members
 * @param adminCount members holding the admin role
 * @param ownerCount members holding the owner role
 * @param createdAt company creation time
 * @param lastJoinedAt time the most recent member joined, null without members
 */
public record CompanyStatistics(
        int userCount, int adminCount, int ownerCount, Instant createdAt, Instant lastJoinedAt) {}
