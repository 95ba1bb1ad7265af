/**
 * Flyway migration configuration and utilities.
 *
 * <ul>
 *   <li>{@link com.tenantguard.database.migration.FlywayConfigProperties}: externalized
 *       configuration bound from {@code tenantguard.flyway.*}
 *   <li>{@link com.tenantguard.database.migration.TenancyFlywayConfig}: Spring
 *       {@code @Configuration} that creates and runs the tenancy Flyway instance
 *   <li>{@link com.tenantguard.database.migration.MigrationService}: migration status for health
 *       checks and diagnostics
 * </ul>
 */
package com.tenantguard.database.migration;
