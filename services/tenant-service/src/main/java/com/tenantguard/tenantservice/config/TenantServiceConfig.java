package com.tenantguard.tenantservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantguard.authorization.AccessValidator;
import com.tenantguard.authorization.OwnershipInvariantEnforcer;
import com.tenantguard.authorization.RoleResolver;
import com.tenantguard.authorization.StaffDirectory;
import com.tenantguard.authorization.isolation.TenantIsolationChecker;
import com.tenantguard.database.migration.MigrationService;
import com.tenantguard.database.migration.TenancyFlywayConfig;
import com.tenantguard.membership.MembershipStore;
import com.tenantguard.observability.MetricFactory;
import com.tenantguard.observability.SpanHelper;
import com.tenantguard.tenantservice.domain.CompanyService;
import com.tenantguard.tenantservice.domain.OperationGuard;
import com.tenantguard.tenantservice.domain.TenantService;
import com.tenantguard.tenantservice.infrastructure.jdbc.JdbcMembershipStore;
import com.tenantguard.tenantservice.infrastructure.jdbc.JdbcStaffDirectory;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Wires the store, the authorization components and the facades.
 *
 * <p>The store gets its own {@link JdbcTemplate} and {@link TransactionTemplate} carrying the
 * configured query timeout. When tenancy migrations are enabled the store is created after them.
 */
@Configuration
@Import(TenancyFlywayConfig.class)
public class TenantServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(TenantServiceConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MembershipStore membershipStore(
            DataSource dataSource,
            PlatformTransactionManager transactionManager,
            StoreProperties properties,
            ObjectMapper objectMapper,
            Clock clock,
            ObjectProvider<MigrationService> migrations) {
        migrations.ifAvailable(m -> log.info("Tenancy schema at version {}", m.status().currentVersion()));
        int timeoutSeconds = (int) Math.max(1, properties.queryTimeout().toSeconds());

        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.setQueryTimeout(timeoutSeconds);
        TransactionTemplate transactions = new TransactionTemplate(transactionManager);
        transactions.setTimeout(timeoutSeconds);
        return new JdbcMembershipStore(jdbc, transactions, properties, objectMapper, clock);
    }

    @Bean
    public StaffDirectory staffDirectory(JdbcTemplate jdbcTemplate) {
        return new JdbcStaffDirectory(jdbcTemplate);
    }

    @Bean
    public RoleResolver roleResolver(MembershipStore store, StaffDirectory staffDirectory) {
        return new RoleResolver(store, staffDirectory);
    }

    @Bean
    public AccessValidator accessValidator(RoleResolver roleResolver) {
        return new AccessValidator(roleResolver);
    }

    @Bean
    public OwnershipInvariantEnforcer ownershipInvariantEnforcer(MembershipStore store) {
        return new OwnershipInvariantEnforcer(store);
    }

    @Bean
    public TenantIsolationChecker tenantIsolationChecker(MembershipStore store) {
        return new TenantIsolationChecker(store);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, TenantServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer("tenantguard"));
    }

    @Bean
    public OperationGuard operationGuard(MetricFactory metricFactory, SpanHelper spanHelper) {
        return new OperationGuard(metricFactory, spanHelper);
    }

    @Bean
    public TenantService tenantService(
            MembershipStore store,
            AccessValidator accessValidator,
            OwnershipInvariantEnforcer ownershipInvariantEnforcer,
            OperationGuard operationGuard) {
        return new TenantService(store, accessValidator, ownershipInvariantEnforcer, operationGuard);
    }

    @Bean
    public CompanyService companyService(
            MembershipStore store,
            AccessValidator accessValidator,
            OwnershipInvariantEnforcer ownershipInvariantEnforcer,
            OperationGuard operationGuard) {
        return new CompanyService(store, accessValidator, ownershipInvariantEnforcer, operationGuard);
    }
}
