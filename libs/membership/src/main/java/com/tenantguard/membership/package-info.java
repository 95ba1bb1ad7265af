/**
 * Membership data model and the persistence port behind it.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>value types for tenants, companies, users and the two membership flavours
 *   <li>{@link com.tenantguard.membership.CompanyRole}: the closed, totally ordered company role
 *   <li>{@link com.tenantguard.membership.TenantRoles}: the open set of tenant-level role labels
 *   <li>{@link com.tenantguard.membership.MembershipStore}: the store port; no policy lives here
 * </ul>
 */
package com.tenantguard.membership;
