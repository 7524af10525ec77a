package com.policyai.domain.suggestion.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum SuggestionIntent {
    SUGGEST_CLAUSE("suggest-clause"),
    MAP_POLICY("map-policy"),
    REVIEW_POLICY("review-policy"),
    SUGGEST_IMPROVEMENT("suggest-improvement"),
    VALIDATE_COMPLIANCE("validate-compliance");

    private final String value;

    SuggestionIntent(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves the wire value ("suggest-clause") or the constant name ("SUGGEST_CLAUSE").
     * Underscores and hyphens are interchangeable.
     */
    public static Optional<SuggestionIntent> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().replace('_', '-');
        return Arrays.stream(values())
                .filter(i -> i.value.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
