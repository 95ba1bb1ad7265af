package com.tenantguard.tenantservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code tenantguard.service.*}.
 *
 * <pre>
 * tenantguard:
 *   service:
 *     name: tenant-service
 *     environment: production
 *     description: Tenant membership and authorization
 * </pre>
 *
 * @param name Service name used for logging and metrics. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param description Human-readable service description for the info endpoint.
 */
@ConfigurationProperties(prefix = "tenantguard.service")
@Validated
public record TenantServiceProperties(@NotBlank String name, String environment, String description) {

    public TenantServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
