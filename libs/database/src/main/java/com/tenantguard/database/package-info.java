/**
 * Schema ownership for the tenant authorization tables: Flyway configuration, migration status
 * reporting and the versioned SQL scripts under {@code db/migration}.
 */
package com.tenantguard.database;
