package com.policyai.domain.suggestion.model;

import java.util.List;

/**
 * Response returned for every completed pipeline run, successful or not.
 * A fallback response never carries a suggestion or source references.
 */
public record SuggestionResponse(
        String id,
        SuggestionContent suggestion,
        List<SourceReference> sourceReferences,
        double confidence,
        boolean requiresHumanReview,
        boolean fallbackUsed,
        String fallbackMessage,
        ResponseMetadata metadata
) {
    public static SuggestionResponse success(String id,
                                             SuggestionContent suggestion,
                                             List<SourceReference> sourceReferences,
                                             double confidence,
                                             boolean requiresHumanReview,
                                             ResponseMetadata metadata) {
        return new SuggestionResponse(id, suggestion, List.copyOf(sourceReferences), confidence,
                requiresHumanReview, false, null, metadata);
    }

    public static SuggestionResponse fallback(String id, String fallbackMessage, ResponseMetadata metadata) {
        return new SuggestionResponse(id, null, List.of(), 0.0, true, true, fallbackMessage, metadata);
    }
}
