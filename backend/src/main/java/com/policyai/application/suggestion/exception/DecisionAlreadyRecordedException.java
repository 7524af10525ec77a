package com.policyai.application.suggestion.exception;

public class DecisionAlreadyRecordedException extends RuntimeException {
    public DecisionAlreadyRecordedException(String suggestionId) {
        super("A decision has already been recorded for suggestion " + suggestionId);
    }
}
