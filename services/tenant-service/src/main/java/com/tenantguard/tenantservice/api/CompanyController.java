package com.tenantguard.tenantservice.api;

import static com.tenantguard.tenantservice.infrastructure.web.CorrelationIdFilter.USER_ID_HEADER;

import com.tenantguard.authorization.CompanyNotFoundException;
import com.tenantguard.authorization.TenantAccessException;
import com.tenantguard.authorization.TenantValidationException;
import com.tenantguard.membership.Company;
import com.tenantguard.membership.CompanyMembership;
import com.tenantguard.membership.CompanyRole;
import com.tenantguard.tenantservice.api.ApiRequests.CompanyRoleRequest;
import com.tenantguard.tenantservice.api.ApiRequests.CreateCompanyRequest;
import com.tenantguard.tenantservice.api.ApiRequests.UpdateCompanyRequest;
import com.tenantguard.tenantservice.domain.CompanyService;
import com.tenantguard.tenantservice.domain.CompanyStatistics;
import com.tenantguard.tenantservice.domain.CompanyUser;
import com.tenantguard.tenantservice.domain.TenantService;
import com.tenantguard.tenantservice.domain.UserCompany;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Company endpoints, nested under the owning tenant, plus the caller-facing list of a user's companies.
 */
@RestController
@RequestMapping("/api/v1")
public class CompanyController {

    private final CompanyService companyService;
    private final TenantService tenantService;

    public CompanyController(CompanyService companyService, TenantService tenantService) {
        this.companyService = companyService;
        this.tenantService = tenantService;
    }

    @GetMapping("/tenants/{tenantId}/companies")
    public List<Company> companies(@RequestHeader(USER_ID_HEADER) String callerId, @PathVariable String tenantId) {
        return companyService.getCompaniesForTenant(tenantId, callerId);
    }

    @PostMapping("/tenants/{tenantId}/companies")
    @ResponseStatus(HttpStatus.CREATED)
    public Company createCompany(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @Valid @RequestBody CreateCompanyRequest request) {
        return companyService.createCompany(tenantId, request.name(), callerId);
    }

    @GetMapping("/tenants/{tenantId}/companies/{companyId}")
    public Company getCompany(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @PathVariable String companyId) {
        return companyService.getCompanyById(tenantId, companyId, callerId)
                .orElseThrow(() -> new CompanyNotFoundException(companyId, tenantId));
    }

    /** Renames a company. The owning tenant never changes. */
    @PatchMapping("/tenants/{tenantId}/companies/{companyId}")
    public Company updateCompany(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @PathVariable String companyId,
            @Valid @RequestBody UpdateCompanyRequest request) {
        return companyService.updateCompany(tenantId, companyId, request.name(), callerId);
    }

    @GetMapping("/tenants/{tenantId}/companies/{companyId}/users")
    public List<CompanyUser> users(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @PathVariable String companyId) {
        return companyService.getCompanyUsers(tenantId, companyId, callerId);
    }

    @GetMapping("/tenants/{tenantId}/companies/{companyId}/statistics")
    public CompanyStatistics statistics(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @PathVariable String companyId) {
        return companyService.getCompanyStatistics(tenantId, companyId, callerId);
    }

    /** Reports whether the caller holds at least {@code minRole} in the company. Never fails on denial. */
    @GetMapping("/tenants/{tenantId}/companies/{companyId}/access")
    public Map<String, Object> checkAccess(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @PathVariable String companyId,
            @RequestParam(name = "minRole", required = false) String minRole) {
        CompanyRole role = ApiRequests.parseRole(minRole, CompanyRole.MEMBER);
        boolean allowed = companyService.validateCompanyAccess(callerId, tenantId, companyId, role);
        return Map.of("tenantId", tenantId, "companyId", companyId, "minRole", role.label(), "allowed", allowed);
    }

    @GetMapping("/users/{userId}/companies")
    public List<UserCompany> userCompanies(@RequestHeader(USER_ID_HEADER) String callerId, @PathVariable String userId) {
        return companyService.getUserCompanies(userId, callerId);
    }

    @PutMapping("/tenants/{tenantId}/companies/{companyId}/users/{userId}")
    public CompanyMembership addUser(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @PathVariable String companyId,
            @PathVariable String userId,
            @RequestBody(required = false) CompanyRoleRequest request) {
        CompanyRole role = ApiRequests.parseRole(request == null ? null : request.role(), CompanyRole.MEMBER);
        return companyService.addUserToCompany(userId, tenantId, companyId, role, callerId);
    }

    @PatchMapping("/tenants/{tenantId}/companies/{companyId}/users/{userId}")
    public CompanyMembership updateRole(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @PathVariable String companyId,
            @PathVariable String userId,
            @RequestBody CompanyRoleRequest request) {
        CompanyRole role = ApiRequests.parseRole(request.role(), null);
        if (role == null) {
            throw new TenantValidationException("role", "role is required");
        }
        return companyService.updateUserCompanyRole(userId, tenantId, companyId, role, callerId);
    }

    @DeleteMapping("/tenants/{tenantId}/companies/{companyId}/users/{userId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeUser(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @PathVariable String companyId,
            @PathVariable String userId) {
        companyService.removeUserFromCompany(userId, tenantId, companyId, callerId);
    }

    @GetMapping("/tenants/{tenantId}/companies/{companyId}/users/{userId}/sole-owner")
    public Map<String, Object> soleOwner(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @PathVariable String companyId,
            @PathVariable String userId) {
        if (!tenantService.validateTenantAccess(callerId, tenantId, CompanyRole.MEMBER)) {
            throw new TenantAccessException(
                    "Insufficient permissions to view company owners", tenantId, callerId, CompanyRole.MEMBER, null);
        }
        return Map.of("userId", userId, "soleOwner", companyService.isOnlyCompanyOwner(userId, tenantId, companyId));
    }
}
