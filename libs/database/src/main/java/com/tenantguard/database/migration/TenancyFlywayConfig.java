package com.tenantguard.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway configuration for the tenancy schema.
 *
 * <p>Replaces Spring Boot's own Flyway auto-configuration so that the migration locations and
 * the optional dedicated schema-owner connection come from {@link FlywayConfigProperties}.
 * Services using this module exclude {@link FlywayAutoConfiguration}:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * <p>The Flyway bean migrates on creation, so every bean depending on {@link #TENANCY_FLYWAY_BEAN}
 * sees an up-to-date schema.
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "tenantguard.flyway", name = "enabled", havingValue = "true")
public class TenancyFlywayConfig {

    /** Bean name of the tenancy Flyway instance. */
    public static final String TENANCY_FLYWAY_BEAN = "tenancyFlyway";

    private static final Logger log = LoggerFactory.getLogger(TenancyFlywayConfig.class);

    @Bean(name = TENANCY_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway tenancyFlyway(FlywayConfigProperties properties, ObjectProvider<DataSource> dataSource) {
        DataSource target = properties.hasDedicatedConnection()
                ? DataSourceBuilder.create()
                        .url(properties.url())
                        .username(properties.username())
                        .password(properties.password())
                        .build()
                : dataSource.getObject();
        log.info("Tenancy migrations enabled: locations={} dedicatedConnection={}",
                properties.locations(), properties.hasDedicatedConnection());
        return createFlyway(target, properties);
    }

    @Bean
    public MigrationService migrationService(Flyway tenancyFlyway) {
        return new MigrationService(tenancyFlyway);
    }

    /**
     * Builds a Flyway instance over the given data source. Clean is always disabled.
     */
    public static Flyway createFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations().toArray(String[]::new))
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
