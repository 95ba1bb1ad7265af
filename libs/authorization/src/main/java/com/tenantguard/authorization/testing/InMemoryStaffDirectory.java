package com.tenantguard.authorization.testing;

import com.tenantguard.authorization.StaffDirectory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable {@link StaffDirectory} for tests and local runs.
 */
public final class InMemoryStaffDirectory implements StaffDirectory {

    private final Set<String> staff = ConcurrentHashMap.newKeySet();

    public static InMemoryStaffDirectory of(String... userIds) {
        InMemoryStaffDirectory directory = new InMemoryStaffDirectory();
        for (String userId : userIds) {
            directory.grant(userId);
        }
        return directory;
    }

    public InMemoryStaffDirectory grant(String userId) {
        staff.add(userId);
        return this;
    }

    public InMemoryStaffDirectory revoke(String userId) {
        staff.remove(userId);
        return this;
    }

    @Override
    public boolean isStaff(String userId) {
        return userId != null && staff.contains(userId);
    }
}
