package com.policyai.domain.suggestion.service;

import com.policyai.domain.suggestion.model.SuggestionIntent;
import com.policyai.domain.user.model.User;

/**
 * Decides whether a user may invoke a given suggestion intent.
 */
public interface RoleGuard {

    /**
     * @throws com.policyai.domain.suggestion.exception.IntentAuthorizationException
     *         if the user's role lacks permission for the intent
     */
    void authorize(User user, SuggestionIntent intent);
}
