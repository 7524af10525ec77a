package com.policyai.infrastructure.ai.pipeline;

import com.policyai.domain.suggestion.model.SuggestionRequest;

import java.util.function.Predicate;

/**
 * Intent-specific companion fields of a {@link SuggestionRequest}.
 */
public enum RequiredField {
    TEMPLATE_REFERENCE("a template reference", r -> hasText(r.templateId())),
    POLICY_REFERENCE("a policy reference", r -> hasText(r.policyId())),
    STANDARDS("at least one target standard",
            r -> r.standards() != null && r.standards().stream().anyMatch(RequiredField::hasText));

    private final String description;
    private final Predicate<SuggestionRequest> presentIn;

    RequiredField(String description, Predicate<SuggestionRequest> presentIn) {
        this.description = description;
        this.presentIn = presentIn;
    }

    public String getDescription() {
        return description;
    }

    public boolean isPresentIn(SuggestionRequest request) {
        return presentIn.test(request);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
