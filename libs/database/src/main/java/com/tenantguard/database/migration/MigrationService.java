package com.tenantguard.database.migration;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationVersion;

/**
 * Reports the migration state of the tenancy schema.
 *
 * <p>Plain object over a {@link Flyway} instance; the service exposes it through its health
 * endpoint.
 */
public class MigrationService {

    /**
     * One known migration.
     *
     * @param version migration version (e.g., "1"); null for repeatable migrations
     * @param description migration description (e.g., "tenancy schema")
     * @param state Flyway state name (e.g., "SUCCESS", "PENDING", "FAILED")
     * @param installedOn ISO-8601 timestamp of when the migration was applied; null when pending
     */
    public record MigrationInfo(String version, String description, String state, String installedOn) {}

    /**
     * Overall migration status.
     *
     * @param appliedMigrations number of successfully applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param failedMigrations number of failed migrations
     * @param currentVersion current schema version (null if no migrations applied)
     */
    public record SchemaStatus(
            int appliedMigrations, int pendingMigrations, int failedMigrations, String currentVersion) {

        /** True when the schema is fully migrated and nothing failed. */
        public boolean upToDate() {
            return pendingMigrations == 0 && failedMigrations == 0;
        }
    }

    private final Flyway flyway;

    public MigrationService(Flyway flyway) {
        this.flyway = Objects.requireNonNull(flyway, "flyway");
    }

    /** Every migration Flyway knows about, in version order. */
    public List<MigrationInfo> migrations() {
        return Arrays.stream(flyway.info().all())
                .map(info -> new MigrationInfo(
                        info.getVersion() == null ? null : info.getVersion().getVersion(),
                        info.getDescription(),
                        info.getState().name(),
                        info.getInstalledOn() == null ? null : info.getInstalledOn().toInstant().toString()))
                .toList();
    }

    /** Summary used by health checks. */
    public SchemaStatus status() {
        var info = flyway.info();
        int failed = (int) Arrays.stream(info.all()).filter(m -> m.getState().isFailed()).count();
        MigrationVersion current = info.current() == null ? null : info.current().getVersion();
        return new SchemaStatus(
                info.applied().length,
                info.pending().length,
                failed,
                current == null ? null : current.getVersion());
    }
}
