package com.policyai.domain.suggestion.exception;

public class SuggestionValidationException extends RuntimeException {

    public SuggestionValidationException(String message) {
        super(message);
    }
}
