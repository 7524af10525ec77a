package com.policyai.domain.suggestion.model;

import java.util.List;

/**
 * A validated request bound to exactly one output format.
 */
public record RoutedRequest(
        SuggestionIntent intent,
        OutputFormat outputFormat,
        String templateId,
        String policyId,
        List<Jurisdiction> jurisdictions,
        String context,
        List<String> standards
) {
    public RoutedRequest {
        jurisdictions = List.copyOf(jurisdictions);
        standards = standards == null ? List.of() : List.copyOf(standards);
    }
}
