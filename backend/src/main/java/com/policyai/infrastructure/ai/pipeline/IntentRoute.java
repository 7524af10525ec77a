package com.policyai.infrastructure.ai.pipeline;

import com.policyai.domain.suggestion.model.OutputFormat;

import java.util.Set;

/**
 * Routing table entry: the output format an intent produces and the companion fields it needs.
 */
public record IntentRoute(OutputFormat outputFormat, Set<RequiredField> requiredFields) {

    public IntentRoute {
        requiredFields = requiredFields == null ? Set.of() : Set.copyOf(requiredFields);
    }
}
