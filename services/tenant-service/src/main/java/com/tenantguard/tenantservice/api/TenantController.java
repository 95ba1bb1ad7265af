package com.tenantguard.tenantservice.api;

import static com.tenantguard.tenantservice.infrastructure.web.CorrelationIdFilter.USER_ID_HEADER;

import com.tenantguard.authorization.TenantAccessException;
import com.tenantguard.authorization.TenantNotFoundException;
import com.tenantguard.membership.CompanyRole;
import com.tenantguard.membership.Tenant;
import com.tenantguard.membership.TenantMembership;
import com.tenantguard.tenantservice.api.ApiRequests.CreateTenantRequest;
import com.tenantguard.tenantservice.api.ApiRequests.TenantRolesRequest;
import com.tenantguard.tenantservice.api.ApiRequests.UpdateTenantRequest;
import com.tenantguard.tenantservice.domain.TenantMembershipView;
import com.tenantguard.tenantservice.domain.TenantPatch;
import com.tenantguard.tenantservice.domain.TenantService;
import com.tenantguard.tenantservice.domain.TenantStatistics;
import com.tenantguard.tenantservice.domain.TenantUser;
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
 * Tenant and tenant membership endpoints.
 *
 * <p>The acting user is taken from the {@code X-User-Id} header, which the upstream identity proxy
 * sets after authentication. Requests without it are rejected with 401.
 */
@RestController
@RequestMapping("/api/v1")
public class TenantController {

    private final TenantService tenantService;

    public TenantController(TenantService tenantService) {
        this.tenantService = tenantService;
    }

    @GetMapping("/tenants")
    public List<TenantMembershipView> myTenants(@RequestHeader(USER_ID_HEADER) String callerId) {
        return tenantService.getUserTenants(callerId);
    }

    @PostMapping("/tenants")
    @ResponseStatus(HttpStatus.CREATED)
    public Tenant createTenant(
            @RequestHeader(USER_ID_HEADER) String callerId, @Valid @RequestBody CreateTenantRequest request) {
        return tenantService.createTenant(
                request.name(), callerId, request.billing() == null ? null : request.billing().toSettings());
    }

    @GetMapping("/tenants/{tenantId}")
    public Tenant getTenant(@RequestHeader(USER_ID_HEADER) String callerId, @PathVariable String tenantId) {
        requireMember(callerId, tenantId, "view tenant");
        return tenantService.getTenantById(tenantId).orElseThrow(() -> new TenantNotFoundException(tenantId));
    }

    @PatchMapping("/tenants/{tenantId}")
    public Tenant updateTenant(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @Valid @RequestBody UpdateTenantRequest request) {
        var patch = new TenantPatch(request.name(), request.billing() == null ? null : request.billing().toPatch());
        return tenantService.updateTenant(tenantId, patch, callerId);
    }

    @GetMapping("/tenants/{tenantId}/statistics")
    public TenantStatistics statistics(@RequestHeader(USER_ID_HEADER) String callerId, @PathVariable String tenantId) {
        return tenantService.getTenantStatistics(tenantId, callerId);
    }

    /** Reports whether the caller holds at least {@code minRole} in the tenant. Never fails on denial. */
    @GetMapping("/tenants/{tenantId}/access")
    public Map<String, Object> checkAccess(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @RequestParam(name = "minRole", required = false) String minRole) {
        CompanyRole role = ApiRequests.parseRole(minRole, CompanyRole.MEMBER);
        boolean allowed = tenantService.validateTenantAccess(callerId, tenantId, role);
        return Map.of("tenantId", tenantId, "minRole", role.label(), "allowed", allowed);
    }

    @GetMapping("/tenants/{tenantId}/users")
    public List<TenantUser> users(@RequestHeader(USER_ID_HEADER) String callerId, @PathVariable String tenantId) {
        return tenantService.getTenantUsers(tenantId, callerId);
    }

    @PutMapping("/tenants/{tenantId}/users/{userId}")
    public TenantMembership addUser(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @PathVariable String userId,
            @RequestBody(required = false) TenantRolesRequest request) {
        var roles = request == null ? null : request.toRoles();
        return tenantService.addUserToTenant(userId, tenantId, roles, callerId);
    }

    @PatchMapping("/tenants/{tenantId}/users/{userId}/roles")
    public TenantMembership updateRoles(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @PathVariable String userId,
            @RequestBody TenantRolesRequest request) {
        return tenantService.updateUserTenantRoles(userId, tenantId, request.toRoles(), callerId);
    }

    @DeleteMapping("/tenants/{tenantId}/users/{userId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeUser(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @PathVariable String userId) {
        tenantService.removeUserFromTenant(userId, tenantId, callerId);
    }

    @GetMapping("/tenants/{tenantId}/users/{userId}/sole-owner")
    public Map<String, Object> soleOwner(
            @RequestHeader(USER_ID_HEADER) String callerId,
            @PathVariable String tenantId,
            @PathVariable String userId) {
        requireMember(callerId, tenantId, "view tenant owners");
        return Map.of("userId", userId, "soleOwner", tenantService.isOnlyTenantOwner(userId, tenantId));
    }

    private void requireMember(String callerId, String tenantId, String action) {
        if (!tenantService.validateTenantAccess(callerId, tenantId, CompanyRole.MEMBER)) {
            throw new TenantAccessException(
                    "Insufficient permissions to " + action, tenantId, callerId, CompanyRole.MEMBER, null);
        }
    }
}
