package com.policyai.application.suggestion.exception;

/**
 * Only the user who requested a suggestion may record a decision on it.
 */
public class DecisionNotPermittedException extends RuntimeException {
    public DecisionNotPermittedException(String suggestionId) {
        super("Not permitted to record a decision on suggestion " + suggestionId);
    }
}
