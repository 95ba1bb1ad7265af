package com.tenantguard.authorization;

/**
 * Port to the identity provider's staff flag.
 * <p>
 * Staff users hold implicit owner-level access to every tenant. The flag lives on the
 * user's profile, outside tenant data.
 */
@FunctionalInterface
public interface StaffDirectory {

    /**
     * @param userId user to look up
     * @return true when the user is flagged as staff
     */
    boolean isStaff(String userId);
}
