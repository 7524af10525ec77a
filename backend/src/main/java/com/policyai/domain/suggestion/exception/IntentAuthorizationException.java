package com.policyai.domain.suggestion.exception;

import com.policyai.domain.suggestion.model.SuggestionIntent;
import com.policyai.domain.user.model.UserRole;

public class IntentAuthorizationException extends RuntimeException {

    public IntentAuthorizationException(UserRole role, SuggestionIntent intent) {
        super(String.format("Role %s is not permitted to request %s suggestions.",
                role, intent != null ? intent.getValue() : "unspecified"));
    }
}
