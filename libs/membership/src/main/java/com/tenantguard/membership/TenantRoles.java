package com.tenantguard.membership;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Open set of tenant-level role labels ({@code member}, {@code admin}, {@code owner},
 * {@code billing}, ...). A user may hold several labels at once.
 * <p>
 * Labels are normalized to lower case and kept sorted. Only {@code member},
 * {@code admin} and {@code owner} take part in the role order; every other label is
 * a plain capability flag.
 *
 * @param labels the normalized, immutable label set
 */
public record TenantRoles(Set<String> labels) {

    /** Label granting tenant ownership. */
    public static final String OWNER = CompanyRole.OWNER.label();

    /** Default label for new members. */
    public static final String MEMBER = CompanyRole.MEMBER.label();

    private static final Pattern LABEL = Pattern.compile("[a-z][a-z0-9_-]{0,63}");

    public TenantRoles {
        if (labels == null) {
            throw new IllegalArgumentException("labels must not be null");
        }
        TreeSet<String> normalized = new TreeSet<>();
        for (String label : labels) {
            String value = normalize(label);
            if (!isValidLabel(value)) {
                throw new IllegalArgumentException("invalid tenant role label: '" + label + "'");
            }
            normalized.add(value);
        }
        labels = Collections.unmodifiableSortedSet(normalized);
    }

    /** Creates a role set from the given labels. */
    public static TenantRoles of(String... labels) {
        return new TenantRoles(new HashSet<>(Arrays.asList(labels)));
    }

    /** Creates a role set from the given labels. */
    public static TenantRoles of(Collection<String> labels) {
        return new TenantRoles(new HashSet<>(labels));
    }

    /** The empty role set. */
    public static TenantRoles none() {
        return new TenantRoles(Set.of());
    }

    /**
     * Checks a label against the accepted syntax after normalization.
     */
    public static boolean isValidLabel(String label) {
        return label != null && LABEL.matcher(normalize(label)).matches();
    }

    public boolean contains(String label) {
        return label != null && labels.contains(normalize(label));
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    /** Whether the set grants tenant ownership. */
    public boolean isOwner() {
        return labels.contains(OWNER);
    }

    /**
     * Returns the highest hierarchical role among the labels, ignoring non-hierarchical
     * labels such as {@code billing}.
     */
    public Optional<CompanyRole> highestHierarchical() {
        CompanyRole highest = null;
        for (String label : labels) {
            Optional<CompanyRole> role = CompanyRole.fromLabel(label);
            if (role.isPresent()) {
                highest = highest == null ? role.get() : highest.max(role.get());
            }
        }
        return Optional.ofNullable(highest);
    }

    private static String normalize(String label) {
        return label == null ? null : label.trim().toLowerCase(Locale.ROOT);
    }
}
