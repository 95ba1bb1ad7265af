package com.tenantguard.tenantservice.api;

import com.tenantguard.database.migration.MigrationService;
import com.tenantguard.database.migration.MigrationService.SchemaStatus;
import com.tenantguard.membership.CompanyRole;
import com.tenantguard.tenantservice.config.StoreProperties;
import com.tenantguard.tenantservice.config.TenantServiceProperties;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Describes this tenancy deployment: the schema version it runs against, how tenant isolation is
 * enforced in the store, and the role vocabulary callers can send. Needs no caller identity.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final TenantServiceProperties properties;
    private final StoreProperties storeProperties;
    private final ObjectProvider<MigrationService> migrationService;

    public ServiceInfoController(
            TenantServiceProperties properties,
            StoreProperties storeProperties,
            ObjectProvider<MigrationService> migrationService) {
        this.properties = properties;
        this.storeProperties = storeProperties;
        this.migrationService = migrationService;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("schema", schema());
        info.put("isolation", Map.of(
                "rowLevelSecurity", storeProperties.rowLevelSecurity(),
                "tenantSetting", storeProperties.tenantSetting()));
        info.put("companyRoles", companyRoles());
        return info;
    }

    private Map<String, Object> schema() {
        MigrationService service = migrationService.getIfAvailable();
        if (service == null) {
            return Map.of("managedBy", "external");
        }
        SchemaStatus status = service.status();
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("managedBy", "service");
        schema.put("currentVersion", status.currentVersion() == null ? "none" : status.currentVersion());
        schema.put("pending", status.pendingMigrations());
        schema.put("upToDate", status.upToDate());
        return schema;
    }

    private static List<String> companyRoles() {
        return Arrays.stream(CompanyRole.values()).map(CompanyRole::label).toList();
    }
}
