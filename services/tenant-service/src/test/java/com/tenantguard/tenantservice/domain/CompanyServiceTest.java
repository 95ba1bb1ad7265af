package com.tenantguard.tenantservice.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.tenantguard.authorization.AccessValidator;
import com.tenantguard.authorization.CompanyNotFoundException;
import com.tenantguard.authorization.MembershipNotFoundException;
import com.tenantguard.authorization.OwnershipInvariantEnforcer;
import com.tenantguard.authorization.OwnershipInvariantException;
import com.tenantguard.authorization.RoleResolver;
import com.tenantguard.authorization.TenantAccessException;
import com.tenantguard.authorization.TenantMismatchException;
import com.tenantguard.authorization.TenantStoreException;
import com.tenantguard.authorization.TenantValidationException;
import com.tenantguard.authorization.testing.InMemoryStaffDirectory;
import com.tenantguard.membership.Company;
import com.tenantguard.membership.CompanyMembership;
import com.tenantguard.membership.CompanyRole;
import com.tenantguard.membership.Tenant;
import com.tenantguard.membership.TenantRoles;
import com.tenantguard.membership.testing.InMemoryMembershipStore;
import com.tenantguard.observability.MetricFactory;
import com.tenantguard.observability.SpanHelper;
import io.opentelemetry.api.OpenTelemetry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CompanyService")
class CompanyServiceTest {

    private InMemoryMembershipStore store;
    private TenantService tenants;
    private CompanyService service;
    private Tenant acme;
    private Company sales;

    @BeforeEach
    void setUp() {
        store = new InMemoryMembershipStore();
        for (String user : List.of("alice", "bob", "carol", "dave", "erin")) {
            store.addUser(user, user + "@example.com");
        }
        var validator = new AccessValidator(new RoleResolver(store, InMemoryStaffDirectory.of()));
        var enforcer = new OwnershipInvariantEnforcer(store);
        var guard = new OperationGuard(new MetricFactory(new SimpleMeterRegistry(), "tenant-service-test"),
                new SpanHelper(OpenTelemetry.noop().getTracer("test")));
        tenants = new TenantService(store, validator, enforcer, guard);
        service = new CompanyService(store, validator, enforcer, guard);

        acme = tenants.createTenant("Acme", "alice");
        tenants.addUserToTenant("bob", acme.id(), TenantRoles.of("admin"), "alice");
        tenants.addUserToTenant("carol", acme.id(), TenantRoles.of("member"), "alice");
        tenants.addUserToTenant("erin", acme.id(), TenantRoles.of("member"), "alice");
        sales = service.createCompany(acme.id(), "Sales", "alice");
    }

    @Nested
    @DisplayName("companies")
    class Companies {

        @Test
        @DisplayName("members list the tenant's companies by name")
        void listByName() {
            service.createCompany(acme.id(), "Accounting", "bob");

            assertThat(service.getCompaniesForTenant(acme.id(), "carol"))
                    .extracting(Company::name)
                    .containsExactly("Accounting", "Sales");
        }

        @Test
        @DisplayName("members cannot create companies")
        void memberCannotCreate() {
            assertThatThrownBy(() -> service.createCompany(acme.id(), "Rogue", "carol"))
                    .isInstanceOf(TenantAccessException.class)
                    .hasMessage("Insufficient permissions to create company");
        }

        @Test
        @DisplayName("blank names are rejected")
        void blankName() {
            assertThatThrownBy(() -> service.createCompany(acme.id(), " ", "alice"))
                    .isInstanceOf(TenantValidationException.class);
        }

        @Test
        @DisplayName("outsiders cannot list companies")
        void outsiderDenied() {
            assertThatThrownBy(() -> service.getCompaniesForTenant(acme.id(), "dave"))
                    .isInstanceOf(TenantAccessException.class);
        }
    }

    @Nested
    @DisplayName("company details")
    class Details {

        @Test
        @DisplayName("members read a company of their tenant, a company of another tenant reads as empty")
        void getById() {
            Tenant globex = tenants.createTenant("Globex", "dave");
            Company hq = service.createCompany(globex.id(), "HQ", "dave");

            assertThat(service.getCompanyById(acme.id(), sales.id(), "carol")).contains(sales);
            assertThat(service.getCompanyById(acme.id(), hq.id(), "alice")).isEmpty();
            assertThatThrownBy(() -> service.getCompanyById(acme.id(), sales.id(), "dave"))
                    .isInstanceOf(TenantAccessException.class);
        }

        @Test
        @DisplayName("admins rename a company and its tenant stays put")
        void rename() {
            Company renamed = service.updateCompany(acme.id(), sales.id(), "  Field Sales ", "bob");

            assertThat(renamed.name()).isEqualTo("Field Sales");
            assertThat(renamed.tenantId()).isEqualTo(acme.id());
            assertThat(renamed.createdAt()).isEqualTo(sales.createdAt());
            assertThat(store.getCompany(sales.id())).map(Company::name).contains("Field Sales");
        }

        @Test
        @DisplayName("members cannot rename, a company admin can")
        void renameAccess() {
            assertThatThrownBy(() -> service.updateCompany(acme.id(), sales.id(), "Mine", "carol"))
                    .isInstanceOf(TenantAccessException.class)
                    .hasMessage("Insufficient permissions to update company");

            service.addUserToCompany("carol", acme.id(), sales.id(), CompanyRole.ADMIN, "alice");

            assertThat(service.updateCompany(acme.id(), sales.id(), "Mine", "carol").name()).isEqualTo("Mine");
        }

        @Test
        @DisplayName("renaming through the wrong tenant is refused and blank names are rejected")
        void renameGuards() {
            Tenant globex = tenants.createTenant("Globex", "dave");
            tenants.addUserToTenant("alice", globex.id(), TenantRoles.of("owner"), "dave");

            assertThatThrownBy(() -> service.updateCompany(globex.id(), sales.id(), "Stolen", "alice"))
                    .isInstanceOf(TenantMismatchException.class);
            assertThatThrownBy(() -> service.updateCompany(acme.id(), sales.id(), " ", "alice"))
                    .isInstanceOf(TenantValidationException.class);
            assertThatThrownBy(() -> service.updateCompany(acme.id(), "nope", "Ghost", "alice"))
                    .isInstanceOf(CompanyNotFoundException.class);
            assertThat(store.getCompany(sales.id())).map(Company::name).contains("Sales");
        }

        @Test
        @DisplayName("company users are listed owners first, then by email")
        void users() {
            service.addUserToCompany("erin", acme.id(), sales.id(), CompanyRole.MEMBER, "alice");
            service.addUserToCompany("carol", acme.id(), sales.id(), CompanyRole.MEMBER, "alice");
            service.addUserToCompany("bob", acme.id(), sales.id(), CompanyRole.OWNER, "alice");

            List<CompanyUser> users = service.getCompanyUsers(acme.id(), sales.id(), "carol");

            assertThat(users).extracting(CompanyUser::userId).containsExactly("bob", "carol", "erin");
            assertThat(users.get(0).email()).isEqualTo("bob@example.com");
            assertThat(users.get(0).role()).isEqualTo(CompanyRole.OWNER);
            assertThat(users).allSatisfy(u -> assertThat(u.companyId()).isEqualTo(sales.id()));
        }

        @Test
        @DisplayName("statistics count members by role")
        void statistics() {
            CompanyStatistics empty = service.getCompanyStatistics(acme.id(), sales.id(), "carol");
            assertThat(empty.userCount()).isZero();
            assertThat(empty.lastJoinedAt()).isNull();

            service.addUserToCompany("bob", acme.id(), sales.id(), CompanyRole.OWNER, "alice");
            service.addUserToCompany("carol", acme.id(), sales.id(), CompanyRole.ADMIN, "alice");
            CompanyMembership last = service.addUserToCompany("erin", acme.id(), sales.id(), CompanyRole.MEMBER, "alice");

            CompanyStatistics stats = service.getCompanyStatistics(acme.id(), sales.id(), "erin");

            assertThat(stats.userCount()).isEqualTo(3);
            assertThat(stats.adminCount()).isEqualTo(1);
            assertThat(stats.ownerCount()).isEqualTo(1);
            assertThat(stats.createdAt()).isEqualTo(sales.createdAt());
            assertThat(stats.lastJoinedAt()).isAfterOrEqualTo(last.joinedAt());
        }

        @Test
        @DisplayName("users list their own companies across tenants, not someone else's")
        void userCompanies() {
            Tenant globex = tenants.createTenant("Globex", "dave");
            tenants.addUserToTenant("carol", globex.id(), TenantRoles.of("member"), "dave");
            Company hq = service.createCompany(globex.id(), "HQ", "dave");
            service.addUserToCompany("carol", acme.id(), sales.id(), CompanyRole.ADMIN, "alice");
            service.addUserToCompany("carol", globex.id(), hq.id(), CompanyRole.MEMBER, "dave");

            List<UserCompany> mine = service.getUserCompanies("carol", "carol");

            assertThat(mine).extracting(c -> c.company().name(), UserCompany::role)
                    .containsExactly(tuple("HQ", CompanyRole.MEMBER), tuple("Sales", CompanyRole.ADMIN));
            assertThatThrownBy(() -> service.getUserCompanies("carol", "alice"))
                    .isInstanceOf(TenantAccessException.class)
                    .hasMessage("Can only view your own companies");
        }

        @Test
        @DisplayName("company access checks answer without throwing")
        void validateAccess() {
            service.addUserToCompany("carol", acme.id(), sales.id(), CompanyRole.ADMIN, "alice");
            Tenant globex = tenants.createTenant("Globex", "dave");
            Company hq = service.createCompany(globex.id(), "HQ", "dave");

            assertThat(service.validateCompanyAccess("carol", acme.id(), sales.id(), CompanyRole.ADMIN)).isTrue();
            assertThat(service.validateCompanyAccess("erin", acme.id(), sales.id(), CompanyRole.ADMIN)).isFalse();
            assertThat(service.validateCompanyAccess("erin", acme.id(), sales.id(), null)).isTrue();
            assertThat(service.validateCompanyAccess("dave", acme.id(), sales.id(), null)).isFalse();
            assertThat(service.validateCompanyAccess("alice", acme.id(), hq.id(), CompanyRole.MEMBER)).isFalse();
            assertThat(service.validateCompanyAccess("alice", acme.id(), "nope", CompanyRole.MEMBER)).isFalse();
        }
    }

    @Nested
    @DisplayName("addUserToCompany")
    class AddUser {

        @Test
        @DisplayName("defaults to member and is idempotent")
        void defaultsAndIdempotent() {
            service.addUserToCompany("carol", acme.id(), sales.id(), null, "bob");
            CompanyMembership again = service.addUserToCompany("carol", acme.id(), sales.id(), null, "bob");

            assertThat(again.role()).isEqualTo(CompanyRole.MEMBER);
            assertThat(store.listCompanyMembershipsForTenant(acme.id())).hasSize(1);
        }

        @Test
        @DisplayName("the user must belong to the tenant")
        void requiresTenantMembership() {
            assertThatThrownBy(() -> service.addUserToCompany("dave", acme.id(), sales.id(), CompanyRole.MEMBER, "alice"))
                    .isInstanceOf(TenantAccessException.class)
                    .hasMessage("User does not have access to this tenant");
        }

        @Test
        @DisplayName("a company of another tenant is refused")
        void foreignCompany() {
            Tenant globex = tenants.createTenant("Globex", "dave");
            Company hq = service.createCompany(globex.id(), "HQ", "dave");

            assertThatThrownBy(() -> service.addUserToCompany("carol", acme.id(), hq.id(), CompanyRole.MEMBER, "alice"))
                    .isInstanceOf(TenantMismatchException.class);
            assertThat(store.getCompanyMembership(hq.id(), "carol")).isEmpty();
        }

        @Test
        @DisplayName("an unknown company is not found")
        void unknownCompany() {
            assertThatThrownBy(() -> service.addUserToCompany("carol", acme.id(), "nope", CompanyRole.MEMBER, "alice"))
                    .isInstanceOf(CompanyNotFoundException.class);
        }

        @Test
        @DisplayName("a company admin manages that company without tenant admin")
        void companyScopedAdmin() {
            service.addUserToCompany("carol", acme.id(), sales.id(), CompanyRole.ADMIN, "alice");

            CompanyMembership added = service.addUserToCompany("erin", acme.id(), sales.id(), CompanyRole.MEMBER, "carol");

            assertThat(added.role()).isEqualTo(CompanyRole.MEMBER);
            Company other = service.createCompany(acme.id(), "Support", "alice");
            assertThatThrownBy(() -> service.addUserToCompany("erin", acme.id(), other.id(), CompanyRole.MEMBER, "carol"))
                    .isInstanceOf(TenantAccessException.class);
        }

        @Test
        @DisplayName("only owners grant company ownership")
        void ownerGrant() {
            assertThatThrownBy(() -> service.addUserToCompany("carol", acme.id(), sales.id(), CompanyRole.OWNER, "bob"))
                    .isInstanceOf(TenantAccessException.class)
                    .hasMessage("Insufficient permissions to grant the owner role");

            service.addUserToCompany("carol", acme.id(), sales.id(), CompanyRole.OWNER, "alice");

            assertThat(service.isOnlyCompanyOwner("carol", acme.id(), sales.id())).isTrue();
        }

        @Test
        @DisplayName("store failures are wrapped")
        void storeFailure() {
            store.failOn("insertCompanyMembership");

            assertThatThrownBy(() -> service.addUserToCompany("carol", acme.id(), sales.id(), null, "alice"))
                    .isInstanceOf(TenantStoreException.class)
                    .hasMessage("Failed to add user to company");
        }
    }

    @Nested
    @DisplayName("role changes and removal")
    class Changes {

        @Test
        @DisplayName("the only company owner cannot be removed")
        void soleCompanyOwner() {
            service.addUserToCompany("carol", acme.id(), sales.id(), CompanyRole.OWNER, "alice");

            assertThatThrownBy(() -> service.removeUserFromCompany("carol", acme.id(), sales.id(), "alice"))
                    .isInstanceOf(OwnershipInvariantException.class)
                    .hasMessage("Cannot remove the only owner of the company");
        }

        @Test
        @DisplayName("demoting the tenant's last owner through a company role is refused")
        void lastTenantOwnerViaCompany() {
            Tenant globex = store.inTransaction(() -> store.insertTenant("Globex"));
            store.insertMembership(globex.id(), "dave", TenantRoles.of("admin"));
            store.insertMembership(globex.id(), "erin", TenantRoles.of("member"));
            Company hq = store.insertCompany(globex.id(), "HQ");
            store.insertCompanyMembership(globex.id(), hq.id(), "erin", CompanyRole.OWNER);
            store.insertCompanyMembership(globex.id(), hq.id(), "dave", CompanyRole.OWNER);

            service.updateUserCompanyRole("dave", globex.id(), hq.id(), CompanyRole.ADMIN, "dave");

            assertThatThrownBy(() -> service.updateUserCompanyRole("erin", globex.id(), hq.id(), CompanyRole.MEMBER, "erin"))
                    .isInstanceOf(OwnershipInvariantException.class)
                    .hasMessage("Cannot remove the only owner of the tenant");
        }

        @Test
        @DisplayName("an admin removes a member from the company")
        void removeMember() {
            service.addUserToCompany("carol", acme.id(), sales.id(), CompanyRole.MEMBER, "alice");

            service.removeUserFromCompany("carol", acme.id(), sales.id(), "bob");

            assertThat(store.getCompanyMembership(sales.id(), "carol")).isEmpty();
            assertThat(store.getMembership(acme.id(), "carol")).isPresent();
        }

        @Test
        @DisplayName("changing a missing membership is not found")
        void missing() {
            assertThatThrownBy(() -> service.updateUserCompanyRole("carol", acme.id(), sales.id(), CompanyRole.ADMIN, "alice"))
                    .isInstanceOf(MembershipNotFoundException.class);
            assertThatThrownBy(() -> service.removeUserFromCompany("carol", acme.id(), sales.id(), "alice"))
                    .isInstanceOf(MembershipNotFoundException.class);
        }

        @Test
        @DisplayName("an admin cannot revoke company ownership")
        void adminCannotRevokeOwner() {
            service.addUserToCompany("carol", acme.id(), sales.id(), CompanyRole.OWNER, "alice");

            assertThatThrownBy(() -> service.updateUserCompanyRole("carol", acme.id(), sales.id(), CompanyRole.MEMBER, "bob"))
                    .isInstanceOf(TenantAccessException.class)
                    .hasMessage("Insufficient permissions to revoke the owner role");
        }
    }
}
