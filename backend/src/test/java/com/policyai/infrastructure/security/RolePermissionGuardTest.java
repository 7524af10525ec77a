package com.policyai.infrastructure.security;

import com.policyai.domain.suggestion.exception.IntentAuthorizationException;
import com.policyai.domain.suggestion.model.SuggestionIntent;
import com.policyai.domain.user.model.User;
import com.policyai.domain.user.model.UserRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RolePermissionGuardTest {

    private final RolePermissionGuard guard = new RolePermissionGuard();

    private static User user(UserRole role) {
        return new User("user-1", role, "org-1");
    }

    @ParameterizedTest
    @CsvSource({
            "SYSTEM_ADMIN, VALIDATE_COMPLIANCE",
            "COMPLIANCE_OFFICER, MAP_POLICY",
            "CARE_HOME_MANAGER, SUGGEST_CLAUSE",
            "CARE_HOME_MANAGER, SUGGEST_IMPROVEMENT",
            "QUALITY_ASSURANCE, REVIEW_POLICY",
            "QUALITY_ASSURANCE, VALIDATE_COMPLIANCE"
    })
    void permitted_combinations_pass(UserRole role, SuggestionIntent intent) {
        assertThatCode(() -> guard.authorize(user(role), intent)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @CsvSource({
            "CARE_HOME_MANAGER, VALIDATE_COMPLIANCE",
            "QUALITY_ASSURANCE, SUGGEST_CLAUSE",
            "QUALITY_ASSURANCE, MAP_POLICY"
    })
    void other_combinations_are_denied(UserRole role, SuggestionIntent intent) {
        assertThatThrownBy(() -> guard.authorize(user(role), intent))
                .isInstanceOf(IntentAuthorizationException.class)
                .hasMessage("Role " + role + " is not permitted to request " + intent.getValue() + " suggestions.");
    }

    @ParameterizedTest
    @EnumSource(SuggestionIntent.class)
    @DisplayName("Care staff cannot request any suggestion")
    void care_staff_has_no_permissions(SuggestionIntent intent) {
        assertThatThrownBy(() -> guard.authorize(user(UserRole.CARE_STAFF), intent))
                .isInstanceOf(IntentAuthorizationException.class);
    }

    @Test
    void missing_role_is_denied() {
        assertThatThrownBy(() -> guard.authorize(new User("user-1", null, "org-1"), SuggestionIntent.SUGGEST_CLAUSE))
                .isInstanceOf(IntentAuthorizationException.class);
        assertThatThrownBy(() -> guard.authorize(null, SuggestionIntent.SUGGEST_CLAUSE))
                .isInstanceOf(IntentAuthorizationException.class);
    }
}
