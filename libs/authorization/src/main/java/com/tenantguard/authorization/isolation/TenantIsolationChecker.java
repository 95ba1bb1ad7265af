package com.tenantguard.authorization.isolation;

import com.tenantguard.membership.CompanyRole;
import com.tenantguard.membership.MembershipStore;
import com.tenantguard.membership.StoreSnapshot;
import com.tenantguard.membership.StoreSnapshot.CompanyMemberRow;
import com.tenantguard.membership.StoreSnapshot.CompanyRow;
import com.tenantguard.membership.StoreSnapshot.TenantMemberRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Detection pass over the membership tables.
 * <p>
 * Works on a read-only {@link StoreSnapshot}, so it never competes with writers for locks and
 * never runs in the write path. Flags rows whose tenant differs from their parent's tenant,
 * rows referencing missing tenants, companies or users, rows with null tenant identifiers,
 * unknown company roles and blank company names. It only reports; repair is a separate,
 * explicitly authorized operation.
 */
public final class TenantIsolationChecker {

    public static final String TABLE_COMPANIES = "companies";
    public static final String TABLE_TENANT_USERS = "tenant_users";
    public static final String TABLE_USER_COMPANIES = "user_companies";

    private static final Logger log = LoggerFactory.getLogger(TenantIsolationChecker.class);

    private final MembershipStore store;

    public TenantIsolationChecker(MembershipStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Takes a snapshot of the store and checks it.
     */
    public IsolationReport run() {
        IsolationReport report = check(store.snapshot());
        if (report.isClean()) {
            log.info("Tenant isolation check passed: {} rows scanned", report.rowsScanned());
        } else {
            log.warn("Tenant isolation check found {} violating rows in {} groups",
                    report.violatingRowCount(), report.violations().size());
            report.violations().forEach(v ->
                    log.warn("  {} {}: {}", v.table(), v.type(), v.violatingRowIds()));
        }
        return report;
    }

    /**
     * Checks a given snapshot.
     */
    public IsolationReport check(StoreSnapshot snapshot) {
        List<IsolationViolation> violations = new ArrayList<>();
        violations.addAll(checkCompanies(snapshot));
        violations.addAll(checkTenantMemberships(snapshot));
        violations.addAll(checkCompanyMemberships(snapshot));
        return new IsolationReport(snapshot.takenAt(), snapshot.rowCount(), violations);
    }

    private List<IsolationViolation> checkCompanies(StoreSnapshot snapshot) {
        Findings findings = new Findings(TABLE_COMPANIES);
        for (CompanyRow row : snapshot.companies()) {
            if (row.tenantId() == null) {
                findings.add(ViolationType.NULL_TENANT, row.id());
            } else if (!snapshot.tenantIds().contains(row.tenantId())) {
                findings.add(ViolationType.MISSING_TENANT, row.id());
            }
            if (row.name() == null || row.name().isBlank()) {
                findings.add(ViolationType.BLANK_NAME, row.id());
            }
        }
        return findings.toViolations();
    }

    private List<IsolationViolation> checkTenantMemberships(StoreSnapshot snapshot) {
        Findings findings = new Findings(TABLE_TENANT_USERS);
        for (TenantMemberRow row : snapshot.tenantMemberships()) {
            if (row.tenantId() == null) {
                findings.add(ViolationType.NULL_TENANT, row.id());
            } else if (!snapshot.tenantIds().contains(row.tenantId())) {
                findings.add(ViolationType.MISSING_TENANT, row.id());
            }
            if (!snapshot.userIds().contains(row.userId())) {
                findings.add(ViolationType.MISSING_USER, row.id());
            }
        }
        return findings.toViolations();
    }

    private List<IsolationViolation> checkCompanyMemberships(StoreSnapshot snapshot) {
        Map<String, CompanyRow> companies = new HashMap<>();
        for (CompanyRow company : snapshot.companies()) {
            companies.put(company.id(), company);
        }

        Findings findings = new Findings(TABLE_USER_COMPANIES);
        for (CompanyMemberRow row : snapshot.companyMemberships()) {
            CompanyRow company = companies.get(row.companyId());
            if (row.tenantId() == null) {
                findings.add(ViolationType.NULL_TENANT, row.id());
            } else if (!snapshot.tenantIds().contains(row.tenantId())) {
                findings.add(ViolationType.MISSING_TENANT, row.id());
            }
            if (company == null) {
                findings.add(ViolationType.MISSING_COMPANY, row.id());
            } else if (row.tenantId() != null && company.tenantId() != null
                    && !row.tenantId().equals(company.tenantId())) {
                findings.add(ViolationType.TENANT_MISMATCH, row.id());
            }
            if (!snapshot.userIds().contains(row.userId())) {
                findings.add(ViolationType.MISSING_USER, row.id());
            }
            if (!CompanyRole.isKnown(row.role())) {
                findings.add(ViolationType.INVALID_ROLE, row.id());
            }
        }
        return findings.toViolations();
    }

    /** Offending row ids of one table, grouped by violation type. */
    private static final class Findings {

        private final String table;
        private final Map<ViolationType, List<String>> rows = new EnumMap<>(ViolationType.class);

        Findings(String table) {
            this.table = table;
        }

        void add(ViolationType type, String rowId) {
            rows.computeIfAbsent(type, t -> new ArrayList<>()).add(rowId);
        }

        List<IsolationViolation> toViolations() {
            List<IsolationViolation> violations = new ArrayList<>();
            rows.forEach((type, ids) -> violations.add(new IsolationViolation(
                    table, type, ids.stream().sorted().toList(),
                    "%d %s row(s): %s".formatted(ids.size(), table, type.description()))));
            return violations;
        }
    }
}
