package com.tenantguard.database.migration;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the tenancy schema.
 *
 * <p>When {@code url} is blank the migrations run against the application's own
 * {@code DataSource}; otherwise a dedicated connection is opened with the given credentials
 * (useful when the schema owner differs from the runtime user, as row-level security requires).
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * tenantguard:
 *   flyway:
 *     enabled: true
 *     url: jdbc:postgresql://localhost:5432/tenantguard
 *     username: tenantguard_owner
 *     password: secret
 *     locations:
 *       - classpath:db/migration/tenancy
 *       - classpath:db/migration/postgresql
 * }</pre>
 *
 * @param url JDBC URL of a dedicated migration connection; blank to reuse the application one
 * @param username migration user, used together with {@code url}
 * @param password migration password
 * @param locations Flyway migration locations
 * @param enabled whether to run migrations on startup
 */
@Validated
@ConfigurationProperties(prefix = "tenantguard.flyway")
public record FlywayConfigProperties(
        String url,
        String username,
        String password,
        @NotEmpty List<String> locations,
        boolean enabled) {

    /** Portable schema, valid on PostgreSQL and on H2 in PostgreSQL mode. */
    public static final String TENANCY_LOCATION = "classpath:db/migration/tenancy";

    /** PostgreSQL-only additions such as row-level security policies. */
    public static final String POSTGRESQL_LOCATION = "classpath:db/migration/postgresql";

    public FlywayConfigProperties {
        locations = locations == null || locations.isEmpty()
                ? List.of(TENANCY_LOCATION)
                : List.copyOf(locations);
    }

    /** Whether migrations use their own connection instead of the application's. */
    public boolean hasDedicatedConnection() {
        return url != null && !url.isBlank();
    }
}
