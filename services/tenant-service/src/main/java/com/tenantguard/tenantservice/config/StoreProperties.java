package com.tenantguard.tenantservice.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Relational membership store settings, bound from {@code tenantguard.store.*}.
 *
 * <pre>
 * tenantguard:
 *   store:
 *     query-timeout: 5s
 *     row-level-security: true
 *     tenant-setting: app.current_tenant_id
 * </pre>
 *
 * @param queryTimeout deadline applied to every statement and transaction, lock waits included
 * @param rowLevelSecurity whether to publish the tenant context to PostgreSQL row-level security
 * @param tenantSetting name of the session setting the RLS policies read
 */
@ConfigurationProperties(prefix = "tenantguard.store")
@Validated
public record StoreProperties(
        @NotNull Duration queryTimeout, boolean rowLevelSecurity, @NotBlank String tenantSetting) {

    public static final String DEFAULT_TENANT_SETTING = "app.current_tenant_id";

    public StoreProperties {
        if (queryTimeout == null || queryTimeout.isZero() || queryTimeout.isNegative()) {
            queryTimeout = Duration.ofSeconds(5);
        }
        if (tenantSetting == null || tenantSetting.isBlank()) {
            tenantSetting = DEFAULT_TENANT_SETTING;
        }
    }
}
