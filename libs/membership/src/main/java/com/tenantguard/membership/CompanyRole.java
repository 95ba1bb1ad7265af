package com.tenantguard.membership;

import java.util.Locale;
import java.util.Optional;

/**
 * Company-scoped roles with a total order: {@code MEMBER < ADMIN < OWNER}.
 * <p>
 * The same ordering is used as the ladder for access checks at tenant scope, where
 * the hierarchical tenant labels ({@code member}, {@code admin}, {@code owner}) map
 * onto these constants.
 */
public enum CompanyRole {

    MEMBER("member", 0),
    ADMIN("admin", 1),
    OWNER("owner", 2);

    private final String label;
    private final int rank;

    CompanyRole(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    /** The persisted lower-case label (e.g., "admin"). */
    public String label() {
        return label;
    }

    /** Position in the total order, starting at 0 for {@link #MEMBER}. */
    public int rank() {
        return rank;
    }

    /**
     * Checks whether this role is at least as privileged as {@code required}.
     */
    public boolean atLeast(CompanyRole required) {
        return rank >= required.rank;
    }

    /**
     * Returns the more privileged of the two roles.
     */
    public CompanyRole max(CompanyRole other) {
        return other != null && other.rank > rank ? other : this;
    }

    /**
     * Looks up a role by label, ignoring case and surrounding whitespace.
     *
     * @param label the label to match
     * @return the matching role, or empty if the label is not one of the three known roles
     */
    public static Optional<CompanyRole> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (CompanyRole role : values()) {
            if (role.label.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks whether a string corresponds to a known company role.
     */
    public static boolean isKnown(String label) {
        return fromLabel(label).isPresent();
    }
}
