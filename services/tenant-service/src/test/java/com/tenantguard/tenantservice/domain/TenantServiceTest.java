package com.tenantguard.tenantservice.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

import com.tenantguard.authorization.AccessValidator;
import com.tenantguard.authorization.ErrorKind;
import com.tenantguard.authorization.MembershipNotFoundException;
import com.tenantguard.authorization.OwnershipInvariantEnforcer;
import com.tenantguard.authorization.OwnershipInvariantException;
import com.tenantguard.authorization.RoleResolver;
import com.tenantguard.authorization.TenantAccessException;
import com.tenantguard.authorization.TenantException;
import com.tenantguard.authorization.TenantNotFoundException;
import com.tenantguard.authorization.TenantStoreException;
import com.tenantguard.authorization.TenantValidationException;
import com.tenantguard.authorization.UserNotFoundException;
import com.tenantguard.authorization.testing.InMemoryStaffDirectory;
import com.tenantguard.membership.BillingSettings;
import com.tenantguard.membership.BillingSettings.BillingPatch;
import com.tenantguard.membership.BillingStatus;
import com.tenantguard.membership.Company;
import com.tenantguard.membership.CompanyRole;
import com.tenantguard.membership.StoreException;
import com.tenantguard.membership.Tenant;
import com.tenantguard.membership.TenantMembership;
import com.tenantguard.membership.TenantRoles;
import com.tenantguard.membership.testing.InMemoryMembershipStore;
import com.tenantguard.observability.CorrelationContext;
import com.tenantguard.observability.CorrelationContextHolder;
import com.tenantguard.observability.MetricFactory;
import com.tenantguard.observability.SpanHelper;
import io.opentelemetry.api.OpenTelemetry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TenantService")
class TenantServiceTest {

    private InMemoryMembershipStore store;
    private InMemoryStaffDirectory staff;
    private SimpleMeterRegistry registry;
    private TenantService service;
    private CompanyService companies;
    private Tenant acme;

    @BeforeEach
    void setUp() {
        store = new InMemoryMembershipStore();
        for (String user : List.of("alice", "bob", "carol", "dave", "erin", "root")) {
            store.addUser(user, user + "@example.com");
        }
        staff = InMemoryStaffDirectory.of("root");
        registry = new SimpleMeterRegistry();
        var validator = new AccessValidator(new RoleResolver(store, staff));
        var enforcer = new OwnershipInvariantEnforcer(store);
        var guard = new OperationGuard(new MetricFactory(registry, "tenant-service-test"),
                new SpanHelper(OpenTelemetry.noop().getTracer("test")));
        service = new TenantService(store, validator, enforcer, guard);
        companies = new CompanyService(store, validator, enforcer, guard);

        acme = service.createTenant("Acme", "alice");
        store.insertMembership(acme.id(), "bob", TenantRoles.of("admin"));
        store.insertMembership(acme.id(), "carol", TenantRoles.of("member"));
    }

    @AfterEach
    void tearDown() {
        CorrelationContextHolder.clear();
    }

    private TenantException rejection(Runnable call) {
        try {
            call.run();
        } catch (TenantException e) {
            return e;
        }
        throw new AssertionError("expected a TenantException");
    }

    @Nested
    @DisplayName("createTenant")
    class CreateTenant {

        @Test
        @DisplayName("makes the creator the sole owner")
        void creatorBecomesOwner() {
            Tenant tenant = service.createTenant("  Globex  ", "erin");

            assertThat(tenant.name()).isEqualTo("Globex");
            assertThat(store.getMembership(tenant.id(), "erin"))
                    .map(TenantMembership::roles)
                    .contains(TenantRoles.of("owner"));
            assertThat(service.isOnlyTenantOwner("erin", tenant.id())).isTrue();
        }

        @Test
        @DisplayName("stores billing only when given")
        void billing() {
            Tenant withBilling = service.createTenant("Globex", "erin",
                    new BillingSettings("pro", null, Map.of("seats", 10)));
            Tenant without = service.createTenant("Initech", "erin");

            assertThat(store.getBillingSettings(withBilling.id()))
                    .hasValueSatisfying(b -> {
                        assertThat(b.plan()).isEqualTo("pro");
                        assertThat(b.status()).isEqualTo(BillingStatus.ACTIVE);
                        assertThat(b.settings()).containsEntry("seats", 10);
                    });
            assertThat(store.getBillingSettings(without.id())).isEmpty();
        }

        @Test
        @DisplayName("rejects blank and overlong names")
        void invalidNames() {
            assertThatThrownBy(() -> service.createTenant("   ", "erin"))
                    .isInstanceOf(TenantValidationException.class);
            assertThatThrownBy(() -> service.createTenant("x".repeat(256), "erin"))
                    .isInstanceOf(TenantValidationException.class);
        }

        @Test
        @DisplayName("unknown creator leaves no tenant behind")
        void unknownCreator() {
            int before = store.snapshot().tenantIds().size();

            assertThatThrownBy(() -> service.createTenant("Ghost", "nobody"))
                    .isInstanceOf(UserNotFoundException.class)
                    .hasMessage("User not found");
            assertThat(store.snapshot().tenantIds()).hasSize(before);
        }

        @Test
        @DisplayName("a failed owner insert rolls the tenant back")
        void rollback() {
            int before = store.snapshot().tenantIds().size();
            store.failOn("insertMembership");

            assertThatThrownBy(() -> service.createTenant("Globex", "erin"))
                    .isInstanceOf(TenantStoreException.class)
                    .hasMessage("Failed to create tenant");
            assertThat(store.snapshot().tenantIds()).hasSize(before);
        }
    }

    @Nested
    @DisplayName("addUserToTenant")
    class AddUser {

        @Test
        @DisplayName("admin adds a member; empty roles default to member")
        void adminAddsMember() {
            TenantMembership membership = service.addUserToTenant("erin", acme.id(), TenantRoles.none(), "bob");

            assertThat(membership.roles()).isEqualTo(TenantRoles.of("member"));
            assertThat(service.validateTenantAccess("erin", acme.id())).isTrue();
            assertThat(service.validateTenantAccess("erin", acme.id(), CompanyRole.ADMIN)).isFalse();
        }

        @Test
        @DisplayName("is idempotent")
        void idempotent() {
            service.addUserToTenant("erin", acme.id(), TenantRoles.of("member"), "alice");
            service.addUserToTenant("erin", acme.id(), TenantRoles.of("member"), "alice");

            assertThat(store.listMembershipsForTenant(acme.id()))
                    .filteredOn(m -> m.userId().equals("erin"))
                    .hasSize(1);
        }

        @Test
        @DisplayName("a member cannot add users and nothing changes")
        void memberDenied() {
            assertThatThrownBy(() -> service.addUserToTenant("erin", acme.id(), TenantRoles.of("member"), "carol"))
                    .isInstanceOf(TenantAccessException.class)
                    .hasMessage("Insufficient permissions to add users");
            assertThat(store.getMembership(acme.id(), "erin")).isEmpty();
        }

        @Test
        @DisplayName("an admin cannot grant ownership")
        void adminCannotGrantOwner() {
            assertThatThrownBy(() -> service.addUserToTenant("erin", acme.id(), TenantRoles.of("owner"), "bob"))
                    .isInstanceOf(TenantAccessException.class)
                    .hasMessage("Insufficient permissions to grant the owner role");
        }

        @Test
        @DisplayName("an owner grants ownership")
        void ownerGrantsOwner() {
            service.addUserToTenant("erin", acme.id(), TenantRoles.of("owner"), "alice");

            assertThat(service.isOnlyTenantOwner("alice", acme.id())).isFalse();
        }

        @Test
        @DisplayName("unknown user is reported as not found")
        void unknownUser() {
            assertThatThrownBy(() -> service.addUserToTenant("nobody", acme.id(), TenantRoles.of("member"), "alice"))
                    .isInstanceOf(UserNotFoundException.class);
        }

        @Test
        @DisplayName("outsiders get access denied for a missing tenant; staff get not found")
        void missingTenant() {
            assertThatThrownBy(() -> service.addUserToTenant("erin", "missing", TenantRoles.of("member"), "dave"))
                    .isInstanceOf(TenantAccessException.class);
            assertThatThrownBy(() -> service.addUserToTenant("erin", "missing", TenantRoles.of("member"), "root"))
                    .isInstanceOf(TenantNotFoundException.class);
        }

        @Test
        @DisplayName("custom labels are kept next to hierarchical ones")
        void customLabels() {
            TenantMembership membership =
                    service.addUserToTenant("erin", acme.id(), TenantRoles.of("member", "billing"), "bob");

            assertThat(membership.roles().labels()).containsExactly("billing", "member");
        }
    }

    @Nested
    @DisplayName("removeUserFromTenant")
    class RemoveUser {

        @Test
        @DisplayName("the only owner cannot remove themselves")
        void soleOwnerSelfRemoval() {
            TenantException e = rejection(() -> service.removeUserFromTenant("alice", acme.id(), "alice"));

            assertThat(e.kind()).isEqualTo(ErrorKind.INVARIANT_VIOLATION);
            assertThat(e).hasMessage("Cannot remove yourself as the only tenant owner");
            assertThat(store.getMembership(acme.id(), "alice")).isPresent();
        }

        @Test
        @DisplayName("an owner can leave once another owner exists")
        void ownerLeavesAfterHandover() {
            service.addUserToTenant("erin", acme.id(), TenantRoles.of("owner"), "alice");

            service.removeUserFromTenant("alice", acme.id(), "alice");

            assertThat(store.getMembership(acme.id(), "alice")).isEmpty();
            assertThat(service.isOnlyTenantOwner("erin", acme.id())).isTrue();
        }

        @Test
        @DisplayName("an admin cannot remove an owner")
        void adminCannotRemoveOwner() {
            service.addUserToTenant("erin", acme.id(), TenantRoles.of("owner"), "alice");

            assertThatThrownBy(() -> service.removeUserFromTenant("erin", acme.id(), "bob"))
                    .isInstanceOf(TenantAccessException.class)
                    .hasMessage("Insufficient permissions to remove an owner");
        }

        @Test
        @DisplayName("also removes the user's company memberships")
        void cascadesToCompanies() {
            Company sales = companies.createCompany(acme.id(), "Sales", "alice");
            companies.addUserToCompany("carol", acme.id(), sales.id(), CompanyRole.ADMIN, "alice");

            service.removeUserFromTenant("carol", acme.id(), "bob");

            assertThat(store.getCompanyMembership(sales.id(), "carol")).isEmpty();
        }

        @Test
        @DisplayName("a non-member yields membership not found")
        void notAMember() {
            assertThatThrownBy(() -> service.removeUserFromTenant("erin", acme.id(), "alice"))
                    .isInstanceOf(MembershipNotFoundException.class);
        }

        @Test
        @DisplayName("concurrent self-removal of two owners leaves one owner")
        void concurrentRemovals() throws Exception {
            service.addUserToTenant("erin", acme.id(), TenantRoles.of("owner"), "alice");
            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Boolean>> results = new ArrayList<>();
                for (String owner : List.of("alice", "erin")) {
                    Callable<Boolean> removal = () -> {
                        start.await();
                        try {
                            service.removeUserFromTenant(owner, acme.id(), owner);
                            return true;
                        } catch (TenantException e) {
                            return false;
                        }
                    };
                    results.add(pool.submit(removal));
                }
                start.countDown();
                int succeeded = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(10, TimeUnit.SECONDS)) {
                        succeeded++;
                    }
                }
                assertThat(succeeded).isEqualTo(1);
            } catch (ExecutionException e) {
                throw new AssertionError(e.getCause());
            } finally {
                pool.shutdownNow();
            }
            assertThat(store.listMembershipsForTenant(acme.id()))
                    .filteredOn(m -> m.roles().isOwner())
                    .hasSize(1);
        }
    }

    @Nested
    @DisplayName("role checks under the tenant lock")
    class LockOrdering {

        private InMemoryMembershipStore demotingBeforeLock(String userId) {
            InMemoryMembershipStore spied = spy(store);
            AtomicBoolean demoted = new AtomicBoolean();
            doAnswer(invocation -> {
                if (demoted.compareAndSet(false, true)) {
                    ExecutorService other = Executors.newSingleThreadExecutor();
                    try {
                        other.submit(() -> service.updateUserTenantRoles(userId, acme.id(), TenantRoles.of("member"), "alice"))
                                .get(10, TimeUnit.SECONDS);
                    } finally {
                        other.shutdownNow();
                    }
                }
                return invocation.callRealMethod();
            }).when(spied).lockTenant(anyString());
            return spied;
        }

        private OperationGuard freshGuard() {
            return new OperationGuard(new MetricFactory(new SimpleMeterRegistry(), "tenant-service-test"),
                    new SpanHelper(OpenTelemetry.noop().getTracer("test")));
        }

        @Test
        @DisplayName("an admin demoted while waiting for the lock can no longer add users")
        void demotedBeforeAdd() {
            InMemoryMembershipStore racing = demotingBeforeLock("bob");
            var validator = new AccessValidator(new RoleResolver(racing, staff));
            var racingService = new TenantService(racing, validator, new OwnershipInvariantEnforcer(racing), freshGuard());

            assertThatThrownBy(() -> racingService.addUserToTenant("dave", acme.id(), TenantRoles.of("admin"), "bob"))
                    .isInstanceOf(TenantAccessException.class);
            assertThat(store.getMembership(acme.id(), "dave")).isEmpty();
            assertThat(store.getMembership(acme.id(), "bob"))
                    .map(TenantMembership::roles)
                    .contains(TenantRoles.of("member"));
        }

        @Test
        @DisplayName("an admin demoted while waiting for the lock can no longer create companies")
        void demotedBeforeCreateCompany() {
            InMemoryMembershipStore racing = demotingBeforeLock("bob");
            var validator = new AccessValidator(new RoleResolver(racing, staff));
            var racingCompanies = new CompanyService(racing, validator, new OwnershipInvariantEnforcer(racing), freshGuard());

            assertThatThrownBy(() -> racingCompanies.createCompany(acme.id(), "Shadow", "bob"))
                    .isInstanceOf(TenantAccessException.class)
                    .hasMessage("Insufficient permissions to create company");
            assertThat(store.listCompaniesForTenant(acme.id())).isEmpty();
        }
    }

    @Nested
    @DisplayName("updateUserTenantRoles")
    class UpdateRoles {

        @Test
        @DisplayName("demoting the only owner is refused")
        void demoteSoleOwner() {
            assertThatThrownBy(() -> service.updateUserTenantRoles("alice", acme.id(), TenantRoles.of("admin"), "alice"))
                    .isInstanceOf(OwnershipInvariantException.class)
                    .hasMessage("Cannot remove the owner role from the only tenant owner");
            assertThat(service.isOnlyTenantOwner("alice", acme.id())).isTrue();
        }

        @Test
        @DisplayName("an admin promotes a member to admin")
        void promoteToAdmin() {
            service.updateUserTenantRoles("carol", acme.id(), TenantRoles.of("admin"), "bob");

            assertThat(service.validateTenantAccess("carol", acme.id(), CompanyRole.ADMIN)).isTrue();
        }

        @Test
        @DisplayName("an admin cannot promote themselves to owner")
        void noSelfEscalation() {
            assertThatThrownBy(() -> service.updateUserTenantRoles("bob", acme.id(), TenantRoles.of("owner"), "bob"))
                    .isInstanceOf(TenantAccessException.class)
                    .hasMessage("Insufficient permissions to grant the owner role");
        }

        @Test
        @DisplayName("an empty role set is rejected")
        void emptyRoles() {
            assertThatThrownBy(() -> service.updateUserTenantRoles("carol", acme.id(), TenantRoles.none(), "alice"))
                    .isInstanceOf(TenantValidationException.class)
                    .hasMessage("At least one role is required");
        }

        @Test
        @DisplayName("a missing membership is reported as not found")
        void missingMembership() {
            assertThatThrownBy(() -> service.updateUserTenantRoles("erin", acme.id(), TenantRoles.of("admin"), "alice"))
                    .isInstanceOf(MembershipNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("getTenantById ignores the current tenant scope")
        void getById() {
            Tenant other = service.createTenant("Globex", "erin");

            Optional<Tenant> found = service.withTenantContext(acme.id(), () -> service.getTenantById(other.id()));

            assertThat(found).map(Tenant::name).contains("Globex");
            assertThat(service.getTenantById("missing")).isEmpty();
        }

        @Test
        @DisplayName("getUserTenants groups companies under their tenant, ordered by name")
        void userTenants() {
            Tenant globex = service.createTenant("Globex", "erin");
            service.addUserToTenant("carol", globex.id(), TenantRoles.of("admin"), "erin");
            Company sales = companies.createCompany(acme.id(), "Sales", "alice");
            Company hq = companies.createCompany(globex.id(), "HQ", "erin");
            companies.addUserToCompany("carol", acme.id(), sales.id(), CompanyRole.MEMBER, "alice");
            companies.addUserToCompany("carol", globex.id(), hq.id(), CompanyRole.ADMIN, "erin");

            List<TenantMembershipView> tenants = service.getUserTenants("carol");

            assertThat(tenants).extracting(v -> v.tenant().name()).containsExactly("Acme", "Globex");
            assertThat(tenants.get(0).companies())
                    .extracting(CompanyMembershipView::name, CompanyMembershipView::role)
                    .containsExactly(tuple("Sales", CompanyRole.MEMBER));
            assertThat(tenants.get(1).companies())
                    .extracting(CompanyMembershipView::name, CompanyMembershipView::role)
                    .containsExactly(tuple("HQ", CompanyRole.ADMIN));
        }

        @Test
        @DisplayName("getUserTenants skips foreign company rows")
        void userTenantsSkipsForeignCompanies() {
            Tenant globex = service.createTenant("Globex", "erin");
            Company hq = companies.createCompany(globex.id(), "HQ", "erin");
            store.injectCompanyMembership("row-1", acme.id(), "carol", hq.id(), "admin");

            List<TenantMembershipView> tenants = service.getUserTenants("carol");

            assertThat(tenants).singleElement().satisfies(v -> assertThat(v.companies()).isEmpty());
        }

        @Test
        @DisplayName("getTenantUsers lists members with their email")
        void tenantUsers() {
            assertThat(service.getTenantUsers(acme.id(), "carol"))
                    .extracting(TenantUser::userId, TenantUser::email)
                    .containsExactlyInAnyOrder(
                            tuple("alice", "alice@example.com"),
                            tuple("bob", "bob@example.com"),
                            tuple("carol", "carol@example.com"));
            assertThatThrownBy(() -> service.getTenantUsers(acme.id(), "dave"))
                    .isInstanceOf(TenantAccessException.class);
        }

        @Test
        @DisplayName("statistics need admin and fall back to unknown billing")
        void statistics() {
            companies.createCompany(acme.id(), "Sales", "alice");

            TenantStatistics stats = service.getTenantStatistics(acme.id(), "bob");

            assertThat(stats.userCount()).isEqualTo(3);
            assertThat(stats.companyCount()).isEqualTo(1);
            assertThat(stats.billingStatus()).isEqualTo(TenantStatistics.UNKNOWN_STATUS);
            assertThat(stats.subscriptionPlan()).isEqualTo(BillingSettings.DEFAULT_PLAN);
            assertThat(stats.createdAt()).isEqualTo(acme.createdAt());
            assertThatThrownBy(() -> service.getTenantStatistics(acme.id(), "carol"))
                    .isInstanceOf(TenantAccessException.class)
                    .hasMessage("Insufficient permissions to view tenant statistics");
        }

        @Test
        @DisplayName("staff see statistics of any tenant")
        void staffStatistics() {
            assertThat(service.getTenantStatistics(acme.id(), "root").userCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("validateTenantAccess never throws")
        void validateNeverThrows() {
            store.failOn("getMembership");

            assertThat(service.validateTenantAccess("alice", acme.id())).isFalse();
            assertThat(service.validateTenantAccess(null, acme.id())).isFalse();
            assertThat(service.validateTenantAccess("alice", " ")).isFalse();
        }
    }

    @Nested
    @DisplayName("updateTenant")
    class UpdateTenant {

        @Test
        @DisplayName("renames and merges billing")
        void renameAndBilling() {
            Tenant updated = service.updateTenant(acme.id(),
                    new TenantPatch("Acme Corp", new BillingPatch("pro", BillingStatus.SUSPENDED, null)), "bob");

            assertThat(updated.name()).isEqualTo("Acme Corp");
            TenantStatistics stats = service.getTenantStatistics(acme.id(), "alice");
            assertThat(stats.subscriptionPlan()).isEqualTo("pro");
            assertThat(stats.billingStatus()).isEqualTo("suspended");
        }

        @Test
        @DisplayName("members cannot update")
        void memberDenied() {
            assertThatThrownBy(() -> service.updateTenant(acme.id(), TenantPatch.rename("Hacked"), "carol"))
                    .isInstanceOf(TenantAccessException.class)
                    .hasMessage("Insufficient permissions to update tenant");
            assertThat(service.getTenantById(acme.id())).map(Tenant::name).contains("Acme");
        }
    }

    @Nested
    @DisplayName("error translation and observability")
    class Errors {

        @Test
        @DisplayName("store failures surface as a retryable store error with a generic message")
        void storeFailure() {
            store.failOn("insertMembership");

            TenantException e = rejection(
                    () -> service.addUserToTenant("erin", acme.id(), TenantRoles.of("member"), "alice"));

            assertThat(e).isInstanceOf(TenantStoreException.class).hasMessage("Failed to add user to tenant");
            assertThat(e.kind().retryable()).isTrue();
            assertThat(e.getCause()).isInstanceOf(StoreException.class);
            assertThat(e.tenantId()).isEqualTo(acme.id());
        }

        @Test
        @DisplayName("outcomes are counted per operation")
        void metrics() {
            service.addUserToTenant("erin", acme.id(), TenantRoles.of("member"), "alice");
            rejection(() -> service.addUserToTenant("dave", acme.id(), TenantRoles.of("member"), "carol"));

            assertThat(registry.find(OperationGuard.OPERATIONS_METRIC)
                    .tags("operation", "add user to tenant", "outcome", "success").counter().count())
                    .isEqualTo(1.0);
            assertThat(registry.find(OperationGuard.OPERATIONS_METRIC)
                    .tags("operation", "add user to tenant", "outcome", "access_denied").counter().count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("tenant context")
    class Context {

        @Test
        @DisplayName("withTenantContext scopes the store and the logging context, then restores both")
        void scoped() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-1"));

            String seen = service.withTenantContext(acme.id(), () -> {
                assertThat(store.currentTenant()).contains(acme.id());
                return CorrelationContextHolder.get().map(CorrelationContext::tenantId).orElse(null);
            });

            assertThat(seen).isEqualTo(acme.id());
            assertThat(store.currentTenant()).isEmpty();
            assertThat(CorrelationContextHolder.get()).map(CorrelationContext::tenantId).isEmpty();
        }

        @Test
        @DisplayName("nested contexts restore the outer tenant")
        void nested() {
            Tenant globex = service.createTenant("Globex", "erin");

            service.withTenantContext(acme.id(), () -> {
                service.withTenantContext(globex.id(), () -> {
                    assertThat(store.currentTenant()).contains(globex.id());
                    return null;
                });
                assertThat(store.currentTenant()).contains(acme.id());
                service.withoutTenantContext(() -> {
                    assertThat(store.currentTenant()).isEmpty();
                    return null;
                });
                assertThat(store.currentTenant()).contains(acme.id());
                return null;
            });
        }

        @Test
        @DisplayName("errors from the work propagate and the scope is still restored")
        void errorsPropagate() {
            assertThatThrownBy(() -> service.withTenantContext(acme.id(), () -> {
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class).hasMessage("boom");
            assertThat(store.currentTenant()).isEmpty();
        }
    }
}
