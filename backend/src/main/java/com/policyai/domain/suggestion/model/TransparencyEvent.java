package com.policyai.domain.suggestion.model;

import java.util.List;

/**
 * Decision metadata sent to the transparency logger at every terminal pipeline state.
 * Mirrors what the audit record stores.
 *
 * @param action         "policy_suggestion_" followed by the intent value
 * @param aiSystemId     always {@link #AI_SYSTEM_ID}
 * @param safetyFlags    the status name when the run did not succeed, otherwise empty
 * @param fallbackReason null on success
 */
public record TransparencyEvent(
        String suggestionId,
        String action,
        String aiSystemId,
        String userId,
        String organizationId,
        SuggestionIntent intent,
        List<Jurisdiction> jurisdictions,
        SuggestionStatus status,
        FallbackReason fallbackReason,
        double confidence,
        List<SourceReference> sourceReferences,
        List<String> safetyFlags,
        long processingTimeMs
) {
    public static final String AI_SYSTEM_ID = "policy-authoring-assistant";
}
