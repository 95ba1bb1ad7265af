/**
 * Tenant and company membership management: the facades every caller goes through, their
 * view types, and the shared operation guard that binds logging context, metrics and store
 * error translation.
 */
package com.tenantguard.tenantservice.domain;
