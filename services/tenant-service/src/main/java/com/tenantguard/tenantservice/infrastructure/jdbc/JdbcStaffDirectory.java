package com.tenantguard.tenantservice.infrastructure.jdbc;

import com.tenantguard.authorization.StaffDirectory;
import com.tenantguard.membership.StoreException;
import java.util.List;
import java.util.Objects;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Reads the staff flag from the identity provider's {@code user_profiles} projection.
 * A user without a profile row is not staff.
 */
public class JdbcStaffDirectory implements StaffDirectory {

    private final JdbcTemplate jdbc;

    public JdbcStaffDirectory(JdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    }

    @Override
    public boolean isStaff(String userId) {
        if (userId == null) {
            return false;
        }
        try {
            List<Boolean> flags = jdbc.queryForList(
                    "SELECT is_staff FROM user_profiles WHERE user_id = ?", Boolean.class, userId);
            return !flags.isEmpty() && Boolean.TRUE.equals(flags.get(0));
        } catch (DataAccessException e) {
            throw new StoreException("isStaff", e);
        }
    }
}
