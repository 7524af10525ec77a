package com.policyai.domain.suggestion.model;

public enum SuggestionStatus {
    SUCCESS,
    FALLBACK,
    ERROR
}
