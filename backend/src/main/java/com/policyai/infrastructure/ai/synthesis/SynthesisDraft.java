package com.policyai.infrastructure.ai.synthesis;

import com.policyai.domain.suggestion.model.SuggestionContent;
import com.policyai.domain.suggestion.model.SynthesisMethod;

import java.util.List;

/**
 * Strategy output before confidence scoring.
 *
 * @param warnings strategy-specific warnings, appended after the shared ones
 */
public record SynthesisDraft(
        SuggestionContent content,
        List<String> sourceIds,
        SynthesisMethod method,
        List<String> warnings
) {
    public SynthesisDraft {
        sourceIds = List.copyOf(sourceIds);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
