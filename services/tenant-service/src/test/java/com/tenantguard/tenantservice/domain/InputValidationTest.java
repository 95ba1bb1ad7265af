package com.tenantguard.tenantservice.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tenantguard.authorization.TenantValidationException;
import com.tenantguard.membership.TenantRoles;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InputValidation")
class InputValidationTest {

    @Nested
    @DisplayName("requireRoles")
    class RequireRoles {

        @Test
        @DisplayName("normalizes valid labels and treats null as no roles")
        void valid() {
            assertThat(InputValidation.requireRoles("roles", List.of(" Admin ", "billing-viewer")))
                    .isEqualTo(TenantRoles.of("admin", "billing-viewer"));
            assertThat(InputValidation.requireRoles("roles", null)).isEqualTo(TenantRoles.none());
        }

        @Test
        @DisplayName("rejects a bad label as a validation error on the given field")
        void invalid() {
            assertThatThrownBy(() -> InputValidation.requireRoles("roles", List.of("member", "Not Valid!")))
                    .isInstanceOfSatisfying(TenantValidationException.class,
                            e -> assertThat(e.field()).isEqualTo("roles"))
                    .hasMessage("Invalid role label: 'Not Valid!'");
        }

        @Test
        @DisplayName("rejects a null label instead of failing inside the role set")
        void nullLabel() {
            assertThatThrownBy(() -> InputValidation.requireRoles("roles", Arrays.asList("member", null)))
                    .isInstanceOf(TenantValidationException.class)
                    .hasMessage("Invalid role label: 'null'");
        }
    }
}
