package com.tenantguard.tenantservice.infrastructure.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantguard.membership.BillingSettings;
import com.tenantguard.membership.BillingStatus;
import com.tenantguard.membership.Company;
import com.tenantguard.membership.CompanyMembership;
import com.tenantguard.membership.CompanyRole;
import com.tenantguard.membership.MembershipStore;
import com.tenantguard.membership.StoreException;
import com.tenantguard.membership.StoreSnapshot;
import com.tenantguard.membership.Tenant;
import com.tenantguard.membership.TenantMembership;
import com.tenantguard.membership.TenantRoles;
import com.tenantguard.membership.UserAccount;
import com.tenantguard.tenantservice.config.StoreProperties;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link MembershipStore} over the relational tenancy schema.
 *
 * <p>Tenant scoping is applied twice: every tenant-scoped statement filters on the scope held in
 * a thread-local, and, when {@link StoreProperties#rowLevelSecurity()} is on, the scope is also
 * published to PostgreSQL through {@code set_config(<tenant-setting>, ?, true)} so the
 * row-level-security policies see it. The setting is transaction-local; a tenant context opened
 * outside a transaction therefore runs inside one.
 *
 * <p>{@link #lockTenant(String)} is {@code SELECT ... FOR UPDATE} on the tenant row. Every
 * statement and transaction carries the configured query timeout, so lock waits are bounded too.
 * All Spring data access exceptions surface as {@link StoreException}.
 */
public class JdbcMembershipStore implements MembershipStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcMembershipStore.class);
    private static final TypeReference<Map<String, Object>> SETTINGS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final StoreProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ThreadLocal<String> scope = new ThreadLocal<>();

    public JdbcMembershipStore(
            JdbcTemplate jdbc,
            TransactionTemplate transactions,
            StoreProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.transactions = Objects.requireNonNull(transactions, "transactions");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ── Tenants ──

    @Override
    public Optional<Tenant> getTenant(String tenantId) {
        if (!visible(tenantId)) {
            return Optional.empty();
        }
        return execute("getTenant", () -> first(jdbc.query(
                "SELECT id, name, created_at, updated_at FROM tenants WHERE id = ?", TENANT, tenantId)));
    }

    @Override
    public Tenant insertTenant(String name) {
        return execute("insertTenant", () -> {
            String id = UUID.randomUUID().toString();
            OffsetDateTime now = now();
            jdbc.update("INSERT INTO tenants (id, name, created_at, updated_at) VALUES (?, ?, ?, ?)",
                    id, name, now, now);
            return new Tenant(id, name, now.toInstant(), now.toInstant());
        });
    }

    @Override
    public Optional<Tenant> updateTenantName(String tenantId, String name) {
        requireWritable("updateTenantName", tenantId);
        return execute("updateTenantName", () -> {
            int updated = jdbc.update("UPDATE tenants SET name = ?, updated_at = ? WHERE id = ?",
                    name, now(), tenantId);
            return updated == 0 ? Optional.<Tenant>empty() : getTenant(tenantId);
        });
    }

    @Override
    public void touchTenant(String tenantId) {
        requireWritable("touchTenant", tenantId);
        execute("touchTenant", () -> jdbc.update("UPDATE tenants SET updated_at = ? WHERE id = ?", now(), tenantId));
    }

    @Override
    public Optional<BillingSettings> getBillingSettings(String tenantId) {
        if (!visible(tenantId)) {
            return Optional.empty();
        }
        return execute("getBillingSettings", () -> first(jdbc.query(
                "SELECT plan, status, settings FROM tenant_billing WHERE tenant_id = ?",
                (rs, n) -> new BillingSettings(
                        rs.getString("plan"),
                        BillingStatus.fromValue(rs.getString("status")).orElse(null),
                        readSettings(rs.getString("settings"))),
                tenantId)));
    }

    @Override
    public void saveBillingSettings(String tenantId, BillingSettings settings) {
        requireWritable("saveBillingSettings", tenantId);
        String json = writeSettings(settings.settings());
        execute("saveBillingSettings", () -> {
            int updated = jdbc.update(
                    "UPDATE tenant_billing SET plan = ?, status = ?, settings = ?, updated_at = ? WHERE tenant_id = ?",
                    settings.plan(), settings.status().value(), json, now(), tenantId);
            if (updated == 0) {
                jdbc.update("INSERT INTO tenant_billing (tenant_id, plan, status, settings, updated_at) "
                                + "VALUES (?, ?, ?, ?, ?)",
                        tenantId, settings.plan(), settings.status().value(), json, now());
            }
            return null;
        });
    }

    // ── Users ──

    @Override
    public Optional<UserAccount> getUser(String userId) {
        return execute("getUser", () -> first(jdbc.query(
                "SELECT id, email FROM users WHERE id = ?",
                (rs, n) -> new UserAccount(rs.getString("id"), rs.getString("email")),
                userId)));
    }

    // ── Companies ──

    @Override
    public Optional<Company> getCompany(String companyId) {
        return execute("getCompany", () -> first(jdbc.query(
                "SELECT id, tenant_id, name, created_at FROM companies WHERE id = ?", COMPANY, companyId)))
                .filter(c -> c.tenantId() != null && visible(c.tenantId()));
    }

    @Override
    public Company insertCompany(String tenantId, String name) {
        requireWritable("insertCompany", tenantId);
        return execute("insertCompany", () -> {
            String id = UUID.randomUUID().toString();
            OffsetDateTime now = now();
            jdbc.update("INSERT INTO companies (id, tenant_id, name, created_at) VALUES (?, ?, ?, ?)",
                    id, tenantId, name, now);
            return new Company(id, tenantId, name, now.toInstant());
        });
    }

    @Override
    public Optional<Company> updateCompanyName(String companyId, String name) {
        Optional<Company> current = getCompany(companyId);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        requireWritable("updateCompanyName", current.get().tenantId());
        return execute("updateCompanyName", () -> {
            jdbc.update("UPDATE companies SET name = ? WHERE id = ? AND tenant_id = ?",
                    name, companyId, current.get().tenantId());
            return getCompany(companyId);
        });
    }

    @Override
    public List<Company> listCompaniesForTenant(String tenantId) {
        if (!visible(tenantId)) {
            return List.of();
        }
        return execute("listCompaniesForTenant", () -> jdbc.query(
                "SELECT id, tenant_id, name, created_at FROM companies WHERE tenant_id = ? ORDER BY name, id",
                COMPANY, tenantId));
    }

    @Override
    public int countCompanies(String tenantId) {
        if (!visible(tenantId)) {
            return 0;
        }
        return execute("countCompanies", () -> count("SELECT COUNT(*) FROM companies WHERE tenant_id = ?", tenantId));
    }

    // ── Tenant memberships ──

    @Override
    public Optional<TenantMembership> getMembership(String tenantId, String userId) {
        if (!visible(tenantId)) {
            return Optional.empty();
        }
        return execute("getMembership", () -> first(memberships(
                "tu.tenant_id = ? AND tu.user_id = ?", tenantId, userId)));
    }

    @Override
    public List<TenantMembership> listMembershipsForUser(String userId) {
        String current = scope.get();
        return execute("listMembershipsForUser", () -> current == null
                ? memberships("tu.user_id = ? AND tu.tenant_id IS NOT NULL", userId)
                : memberships("tu.user_id = ? AND tu.tenant_id = ?", userId, current));
    }

    @Override
    public List<TenantMembership> listMembershipsForTenant(String tenantId) {
        if (!visible(tenantId)) {
            return List.of();
        }
        return execute("listMembershipsForTenant", () -> memberships("tu.tenant_id = ?", tenantId));
    }

    @Override
    public int countMembers(String tenantId) {
        if (!visible(tenantId)) {
            return 0;
        }
        return execute("countMembers", () ->
                count("SELECT COUNT(DISTINCT user_id) FROM tenant_users WHERE tenant_id = ?", tenantId));
    }

    @Override
    public void insertMembership(String tenantId, String userId, TenantRoles roles) {
        requireWritable("insertMembership", tenantId);
        execute("insertMembership", () -> {
            OffsetDateTime now = now();
            jdbc.update("INSERT INTO tenant_users (id, tenant_id, user_id, created_at, updated_at) "
                            + "VALUES (?, ?, ?, ?, ?)",
                    UUID.randomUUID().toString(), tenantId, userId, now, now);
            insertRoles(tenantId, userId, roles);
            return null;
        });
    }

    @Override
    public boolean updateMembershipRoles(String tenantId, String userId, TenantRoles roles) {
        requireWritable("updateMembershipRoles", tenantId);
        return inTransaction(() -> execute("updateMembershipRoles", () -> {
            int updated = jdbc.update("UPDATE tenant_users SET updated_at = ? WHERE tenant_id = ? AND user_id = ?",
                    now(), tenantId, userId);
            if (updated == 0) {
                return false;
            }
            jdbc.update("DELETE FROM tenant_user_roles WHERE tenant_id = ? AND user_id = ?", tenantId, userId);
            insertRoles(tenantId, userId, roles);
            return true;
        }));
    }

    @Override
    public boolean deleteMembership(String tenantId, String userId) {
        requireWritable("deleteMembership", tenantId);
        return inTransaction(() -> execute("deleteMembership", () -> {
            jdbc.update("DELETE FROM tenant_user_roles WHERE tenant_id = ? AND user_id = ?", tenantId, userId);
            return jdbc.update("DELETE FROM tenant_users WHERE tenant_id = ? AND user_id = ?", tenantId, userId) > 0;
        }));
    }

    // ── Company memberships ──

    @Override
    public Optional<CompanyMembership> getCompanyMembership(String companyId, String userId) {
        return execute("getCompanyMembership", () -> first(companyMemberships(
                "company_id = ? AND user_id = ?", companyId, userId)));
    }

    @Override
    public List<CompanyMembership> listCompanyMembershipsForUser(String userId) {
        return execute("listCompanyMembershipsForUser", () -> companyMemberships("user_id = ?", userId));
    }

    @Override
    public List<CompanyMembership> listCompanyMembershipsForTenant(String tenantId) {
        if (!visible(tenantId)) {
            return List.of();
        }
        return execute("listCompanyMembershipsForTenant", () -> companyMemberships("tenant_id = ?", tenantId));
    }

    @Override
    public void insertCompanyMembership(String tenantId, String companyId, String userId, CompanyRole role) {
        requireWritable("insertCompanyMembership", tenantId);
        execute("insertCompanyMembership", () -> {
            OffsetDateTime now = now();
            return jdbc.update("INSERT INTO user_companies (id, tenant_id, user_id, company_id, role, created_at, "
                            + "updated_at) VALUES (?, ?, ?, ?, ?, ?, ?)",
                    UUID.randomUUID().toString(), tenantId, userId, companyId, role.label(), now, now);
        });
    }

    @Override
    public boolean updateCompanyMembershipRole(String companyId, String userId, CompanyRole role) {
        Optional<String> tenantId = companyMembershipTenant("updateCompanyMembershipRole", companyId, userId);
        if (tenantId.isEmpty()) {
            return false;
        }
        requireWritable("updateCompanyMembershipRole", tenantId.get());
        return execute("updateCompanyMembershipRole", () -> jdbc.update(
                "UPDATE user_companies SET role = ?, updated_at = ? WHERE company_id = ? AND user_id = ?",
                role.label(), now(), companyId, userId) > 0);
    }

    @Override
    public boolean deleteCompanyMembership(String companyId, String userId) {
        Optional<String> tenantId = companyMembershipTenant("deleteCompanyMembership", companyId, userId);
        if (tenantId.isEmpty()) {
            return false;
        }
        requireWritable("deleteCompanyMembership", tenantId.get());
        return execute("deleteCompanyMembership", () -> jdbc.update(
                "DELETE FROM user_companies WHERE company_id = ? AND user_id = ?", companyId, userId) > 0);
    }

    @Override
    public int deleteCompanyMembershipsForUser(String tenantId, String userId) {
        requireWritable("deleteCompanyMembershipsForUser", tenantId);
        return execute("deleteCompanyMembershipsForUser", () -> jdbc.update(
                "DELETE FROM user_companies WHERE tenant_id = ? AND user_id = ?", tenantId, userId));
    }

    // ── Execution context ──

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }
        try {
            return transactions.execute(status -> {
                publishScope();
                return work.get();
            });
        } catch (TransactionException e) {
            throw new StoreException("transaction", e);
        }
    }

    @Override
    public void lockTenant(String tenantId) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new StoreException("lockTenant", "no active transaction");
        }
        execute("lockTenant", () -> jdbc.query("SELECT id FROM tenants WHERE id = ? FOR UPDATE",
                (rs, n) -> rs.getString(1), tenantId));
    }

    @Override
    public <T> T withTenantContext(String tenantId, Supplier<T> work) {
        return withScope(Objects.requireNonNull(tenantId, "tenantId"), work);
    }

    @Override
    public <T> T withoutTenantContext(Supplier<T> work) {
        return withScope(null, work);
    }

    @Override
    public Optional<String> currentTenant() {
        return Optional.ofNullable(scope.get());
    }

    @Override
    public StoreSnapshot snapshot() {
        return withoutTenantContext(() -> inTransaction(() -> execute("snapshot", () -> new StoreSnapshot(
                new HashSet<>(jdbc.queryForList("SELECT id FROM tenants", String.class)),
                new HashSet<>(jdbc.queryForList("SELECT id FROM users", String.class)),
                jdbc.query("SELECT id, tenant_id, name FROM companies",
                        (rs, n) -> new StoreSnapshot.CompanyRow(
                                rs.getString("id"), rs.getString("tenant_id"), rs.getString("name"))),
                jdbc.query("SELECT id, tenant_id, user_id FROM tenant_users",
                        (rs, n) -> new StoreSnapshot.TenantMemberRow(
                                rs.getString("id"), rs.getString("tenant_id"), rs.getString("user_id"))),
                jdbc.query("SELECT id, tenant_id, user_id, company_id, role FROM user_companies",
                        (rs, n) -> new StoreSnapshot.CompanyMemberRow(rs.getString("id"),
                                rs.getString("tenant_id"), rs.getString("user_id"),
                                rs.getString("company_id"), rs.getString("role"))),
                clock.instant()))));
    }

    // ── Internals ──

    private <T> T withScope(String tenantId, Supplier<T> work) {
        String previous = scope.get();
        setScope(tenantId);
        try {
            if (properties.rowLevelSecurity()) {
                if (TransactionSynchronizationManager.isActualTransactionActive()) {
                    publishScope();
                    return work.get();
                }
                return inTransaction(work);
            }
            return work.get();
        } finally {
            setScope(previous);
            if (properties.rowLevelSecurity() && TransactionSynchronizationManager.isActualTransactionActive()) {
                publishScope();
            }
        }
    }

    private void setScope(String tenantId) {
        if (tenantId == null) {
            scope.remove();
        } else {
            scope.set(tenantId);
        }
    }

    private void publishScope() {
        if (!properties.rowLevelSecurity()) {
            return;
        }
        String value = scope.get() == null ? "" : scope.get();
        execute("publishScope", () -> jdbc.query("SELECT set_config(?, ?, true)",
                (rs, n) -> rs.getString(1), properties.tenantSetting(), value));
    }

    private boolean visible(String tenantId) {
        String current = scope.get();
        return current == null || current.equals(tenantId);
    }

    private void requireWritable(String operation, String tenantId) {
        String current = scope.get();
        if (current != null && !current.equals(tenantId)) {
            throw new StoreException(operation,
                    "row of tenant %s is outside the current tenant scope %s".formatted(tenantId, current));
        }
    }

    private <T> T execute(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException e) {
            throw new StoreException(operation, e);
        }
    }

    private List<TenantMembership> memberships(String where, Object... args) {
        Map<String, MembershipRow> rows = new LinkedHashMap<>();
        jdbc.query("SELECT tu.id, tu.tenant_id, tu.user_id, tu.created_at, r.role FROM tenant_users tu "
                        + "LEFT JOIN tenant_user_roles r ON r.tenant_id = tu.tenant_id AND r.user_id = tu.user_id "
                        + "WHERE " + where + " ORDER BY tu.tenant_id, tu.user_id",
                rs -> {
                    MembershipRow row = rows.computeIfAbsent(rs.getString("id"), id -> new MembershipRow());
                    row.tenantId = rs.getString("tenant_id");
                    row.userId = rs.getString("user_id");
                    row.joinedAt = instant(rs, "created_at");
                    String role = rs.getString("role");
                    if (role != null) {
                        row.labels.add(role);
                    }
                },
                args);
        List<TenantMembership> result = new ArrayList<>();
        for (MembershipRow row : rows.values()) {
            result.add(new TenantMembership(row.tenantId, row.userId, roles(row), row.joinedAt));
        }
        return result;
    }

    private static TenantRoles roles(MembershipRow row) {
        Set<String> valid = new HashSet<>();
        for (String label : row.labels) {
            if (TenantRoles.isValidLabel(label)) {
                valid.add(label);
            } else {
                log.warn("Ignoring invalid tenant role label '{}' of user={} tenant={}", label, row.userId, row.tenantId);
            }
        }
        return TenantRoles.of(valid);
    }

    private List<CompanyMembership> companyMemberships(String where, Object... args) {
        String current = scope.get();
        String sql = "SELECT tenant_id, user_id, company_id, role, created_at FROM user_companies WHERE "
                + where + " AND tenant_id IS NOT NULL";
        List<Object> params = new ArrayList<>(List.of(args));
        if (current != null) {
            sql += " AND tenant_id = ?";
            params.add(current);
        }
        List<CompanyMembership> result = new ArrayList<>();
        jdbc.query(sql + " ORDER BY tenant_id, company_id, user_id", rs -> {
            Optional<CompanyRole> role = CompanyRole.fromLabel(rs.getString("role"));
            if (role.isEmpty()) {
                log.warn("Hiding company membership with unknown role '{}' (company={}, user={})",
                        rs.getString("role"), rs.getString("company_id"), rs.getString("user_id"));
                return;
            }
            result.add(new CompanyMembership(rs.getString("tenant_id"), rs.getString("user_id"),
                    rs.getString("company_id"), role.get(), instant(rs, "created_at")));
        }, params.toArray());
        return result;
    }

    private Optional<String> companyMembershipTenant(String operation, String companyId, String userId) {
        return execute(operation, () -> first(jdbc.query(
                "SELECT tenant_id FROM user_companies WHERE company_id = ? AND user_id = ?",
                (rs, n) -> rs.getString(1), companyId, userId)));
    }

    private void insertRoles(String tenantId, String userId, TenantRoles roles) {
        for (String label : roles.labels()) {
            jdbc.update("INSERT INTO tenant_user_roles (tenant_id, user_id, role) VALUES (?, ?, ?)",
                    tenantId, userId, label);
        }
    }

    private int count(String sql, Object... args) {
        Integer count = jdbc.queryForObject(sql, Integer.class, args);
        return count == null ? 0 : count;
    }

    private Map<String, Object> readSettings(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, SETTINGS_TYPE);
        } catch (JsonProcessingException e) {
            throw new StoreException("getBillingSettings", e);
        }
    }

    private String writeSettings(Map<String, Object> settings) {
        try {
            return objectMapper.writeValueAsString(settings);
        } catch (JsonProcessingException e) {
            throw new StoreException("saveBillingSettings", e);
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.ofInstant(clock.instant().truncatedTo(ChronoUnit.MICROS), ZoneOffset.UTC);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    private static final RowMapper<Tenant> TENANT = (rs, n) -> new Tenant(
            rs.getString("id"), rs.getString("name"), instant(rs, "created_at"), instant(rs, "updated_at"));

    private static final RowMapper<Company> COMPANY = (rs, n) -> new Company(
            rs.getString("id"), rs.getString("tenant_id"), rs.getString("name"), instant(rs, "created_at"));

    private static final class MembershipRow {
        private String tenantId;
        private String userId;
        private Instant joinedAt;
        private final Set<String> labels = new HashSet<>();
    }
}
