package com.tenantguard.authorization.isolation;

import java.time.Instant;
import java.util.List;

/**
 * Result of one isolation pass. Never implies that anything was repaired.
 *
 * @param checkedAt   time of the snapshot the pass inspected
 * @param rowsScanned number of rows inspected
 * @param violations  offending row groups; empty when the data set is well formed
 */
public record IsolationReport(Instant checkedAt, int rowsScanned, List<IsolationViolation> violations) {

    public IsolationReport {
        violations = List.copyOf(violations);
    }

    public boolean isClean() {
        return violations.isEmpty();
    }

    /** Total number of offending rows across all groups. */
    public int violatingRowCount() {
        return violations.stream().mapToInt(v -> v.violatingRowIds().size()).sum();
    }
}
