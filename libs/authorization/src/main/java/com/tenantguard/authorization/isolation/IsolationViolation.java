package com.tenantguard.authorization.isolation;

import java.util.List;

/**
 * One group of offending rows found by the isolation checker.
 *
 * @param table           table the rows live in
 * @param type            kind of problem
 * @param violatingRowIds ids of the offending rows, sorted
 * @param description     human-readable summary
 */
public record IsolationViolation(String table, ViolationType type, List<String> violatingRowIds, String description) {

    public IsolationViolation {
        violatingRowIds = List.copyOf(violatingRowIds);
    }
}
