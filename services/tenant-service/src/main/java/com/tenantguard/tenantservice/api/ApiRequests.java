package com.tenantguard.tenantservice.api;

import com.tenantguard.authorization.TenantValidationException;
import com.tenantguard.membership.BillingSettings;
import com.tenantguard.membership.BillingSettings.BillingPatch;
import com.tenantguard.membership.BillingStatus;
import com.tenantguard.membership.CompanyRole;
import com.tenantguard.membership.TenantRoles;
import com.tenantguard.tenantservice.domain.InputValidation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;

/**
 * Request bodies accepted by the REST API, with conversion into domain values.
 */
final class ApiRequests {

    private ApiRequests() {}

    record BillingRequest(String plan, String status, Map<String, Object> settings) {

        BillingSettings toSettings() {
            return new BillingSettings(plan, parseStatus(status), settings);
        }

        BillingPatch toPatch() {
            return new BillingPatch(plan, parseStatus(status), settings);
        }
    }

    record CreateTenantRequest(@NotBlank @Size(max = 255) String name, @Valid BillingRequest billing) {}

    record UpdateTenantRequest(@Size(max = 255) String name, @Valid BillingRequest billing) {}

    record TenantRolesRequest(List<String> roles) {

        TenantRoles toRoles() {
            return InputValidation.requireRoles("roles", roles);
        }
    }

    record CreateCompanyRequest(@NotBlank @Size(max = 255) String name) {}

    record UpdateCompanyRequest(@NotBlank @Size(max = 255) String name) {}

    record CompanyRoleRequest(String role) {}

    static CompanyRole parseRole(String label, CompanyRole fallback) {
        if (label == null || label.isBlank()) {
            return fallback;
        }
        return CompanyRole.fromLabel(label)
                .orElseThrow(() -> new TenantValidationException("role", "Unknown role: " + label));
    }

    static BillingStatus parseStatus(String value) {
        if (value == null) {
            return null;
        }
        return BillingStatus.fromValue(value)
                .orElseThrow(() -> new TenantValidationException("billing.status", "Unknown billing status: " + value));
    }
}
