package com.policyai.infrastructure.security;

import com.policyai.domain.suggestion.exception.IntentAuthorizationException;
import com.policyai.domain.suggestion.model.SuggestionIntent;
import com.policyai.domain.suggestion.service.RoleGuard;
import com.policyai.domain.user.model.User;
import com.policyai.domain.user.model.UserRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.policyai.domain.suggestion.model.SuggestionIntent.*;

/**
 * Fixed role-to-intent permission table.
 */
@Slf4j
@Component
public class RolePermissionGuard implements RoleGuard {

    static final Map<UserRole, Set<SuggestionIntent>> PERMISSIONS;

    static {
        Map<UserRole, Set<SuggestionIntent>> permissions = new EnumMap<>(UserRole.class);
        permissions.put(UserRole.SYSTEM_ADMIN, EnumSet.allOf(SuggestionIntent.class));
        permissions.put(UserRole.COMPLIANCE_OFFICER, EnumSet.allOf(SuggestionIntent.class));
        permissions.put(UserRole.CARE_HOME_MANAGER,
                EnumSet.of(SUGGEST_CLAUSE, MAP_POLICY, REVIEW_POLICY, SUGGEST_IMPROVEMENT));
        permissions.put(UserRole.QUALITY_ASSURANCE,
                EnumSet.of(REVIEW_POLICY, SUGGEST_IMPROVEMENT, VALIDATE_COMPLIANCE));
        permissions.put(UserRole.CARE_STAFF, EnumSet.noneOf(SuggestionIntent.class));
        PERMISSIONS = Collections.unmodifiableMap(permissions);
    }

    @Override
    public void authorize(User user, SuggestionIntent intent) {
        UserRole role = user != null ? user.role() : null;
        if (role == null || intent == null || !PERMISSIONS.getOrDefault(role, Set.of()).contains(intent)) {
            log.warn("[RoleGuard] Denied role={} intent={} user={}",
                    role, intent != null ? intent.getValue() : null, user != null ? user.id() : null);
            throw new IntentAuthorizationException(role, intent);
        }
    }
}
