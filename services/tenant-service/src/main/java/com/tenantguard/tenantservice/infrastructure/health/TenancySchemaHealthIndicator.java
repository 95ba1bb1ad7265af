package com.tenantguard.tenantservice.infrastructure.health;

import com.tenantguard.database.migration.MigrationService;
import com.tenantguard.database.migration.MigrationService.SchemaStatus;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN while tenancy migrations are pending or failed. When this service does not run the
 * migrations itself the schema is assumed to be managed elsewhere and the indicator stays UP.
 */
@Component("tenancySchema")
public class TenancySchemaHealthIndicator implements HealthIndicator {

    private final ObjectProvider<MigrationService> migrationService;

    public TenancySchemaHealthIndicator(ObjectProvider<MigrationService> migrationService) {
        this.migrationService = migrationService;
    }

    @Override
    public Health health() {
        MigrationService service = migrationService.getIfAvailable();
        if (service == null) {
            return Health.up().withDetail("migrations", "external").build();
        }
        SchemaStatus status = service.status();
        Health.Builder builder = status.upToDate() ? Health.up() : Health.down();
        return builder
                .withDetail("currentVersion", status.currentVersion() == null ? "none" : status.currentVersion())
                .withDetail("applied", status.appliedMigrations())
                .withDetail("pending", status.pendingMigrations())
                .withDetail("failed", status.failedMigrations())
                .build();
    }
}
