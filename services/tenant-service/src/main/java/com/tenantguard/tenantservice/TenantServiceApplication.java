package com.tenantguard.tenantservice;

import com.tenantguard.tenantservice.config.IsolationProperties;
import com.tenantguard.tenantservice.config.StoreProperties;
import com.tenantguard.tenantservice.config.TenantServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Tenant service: tenant membership, role resolution and access decisions over HTTP.
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics, Prometheus endpoints
 *   <li>Correlation ID and caller propagation into the logging MDC
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 *   <li>Scheduled tenant isolation checks when {@code tenantguard.isolation.enabled=true}
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
    TenantServiceProperties.class,
    StoreProperties.class,
    IsolationProperties.class
})
public class TenantServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(TenantServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TenantServiceApplication.class, args);
        log.info("Tenant service started successfully");
    }
}
