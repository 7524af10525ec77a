package com.policyai.application.suggestion.exception;

public class SuggestionNotFoundException extends RuntimeException {
    public SuggestionNotFoundException(String suggestionId) {
        super("Suggestion not found: " + suggestionId);
    }
}
