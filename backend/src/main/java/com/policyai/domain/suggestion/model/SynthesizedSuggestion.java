package com.policyai.domain.suggestion.model;

import java.util.List;

/**
 * Output of clause synthesis. Lives only for the duration of one request.
 *
 * @param content         assembled content, shape depends on the output format
 * @param confidence      composite confidence in [0, 1]
 * @param sourceIds       ids of the documents the content was assembled from
 * @param method          how the content was assembled
 * @param warnings        human-readable warnings, never thrown
 */
public record SynthesizedSuggestion(
        SuggestionContent content,
        double confidence,
        List<String> sourceIds,
        SynthesisMethod method,
        List<String> warnings
) {}
