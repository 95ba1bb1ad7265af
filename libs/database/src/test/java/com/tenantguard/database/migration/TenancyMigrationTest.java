package com.tenantguard.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.List;
import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Runs the portable tenancy migrations against H2 in PostgreSQL mode.
 */
@DisplayName("Tenancy migrations on H2")
class TenancyMigrationTest {

    private DriverManagerDataSource dataSource;
    private Flyway flyway;

    @BeforeEach
    void setUp() {
        dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
        var props = new FlywayConfigProperties(
                null, null, null, List.of(FlywayConfigProperties.TENANCY_LOCATION), true);
        flyway = TenancyFlywayConfig.createFlyway(dataSource, props);
    }

    @Test
    @DisplayName("reports the schema as pending before migrating")
    void pendingBeforeMigrate() {
        var status = new MigrationService(flyway).status();

        assertThat(status.pendingMigrations()).isEqualTo(1);
        assertThat(status.upToDate()).isFalse();
        assertThat(status.currentVersion()).isNull();
    }

    @Test
    @DisplayName("migrates to version 1 and reports up to date")
    void migrates() {
        flyway.migrate();

        var service = new MigrationService(flyway);
        assertThat(service.status().upToDate()).isTrue();
        assertThat(service.status().currentVersion()).isEqualTo("1");
        assertThat(service.migrations())
                .singleElement()
                .satisfies(m -> {
                    assertThat(m.state()).isEqualTo("SUCCESS");
                    assertThat(m.description()).isEqualTo("tenancy schema");
                    assertThat(m.installedOn()).isNotNull();
                });
    }

    @Test
    @DisplayName("the unique membership constraint holds")
    void uniqueMembership() {
        flyway.migrate();
        var jdbc = new JdbcTemplate(dataSource);
        String insert = "INSERT INTO tenant_users (id, tenant_id, user_id, created_at, updated_at) "
                + "VALUES (?, 't-1', 'u-1', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)";
        jdbc.update(insert, "row-1");

        assertThat(catchThrowable(() -> jdbc.update(insert, "row-2")))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    @DisplayName("accepts orphaned membership rows")
    void acceptsOrphans() {
        flyway.migrate();
        var jdbc = new JdbcTemplate(dataSource);

        int inserted = jdbc.update(
                "INSERT INTO user_companies (id, tenant_id, user_id, company_id, role, created_at, updated_at) "
                        + "VALUES ('row-1', NULL, 'ghost', 'no-company', 'owner', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)");

        assertThat(inserted).isEqualTo(1);
    }
}
