package com.policyai.domain.suggestion.model;

import java.time.Instant;

/**
 * Optional history filters. A null field does not filter; both date bounds are inclusive.
 */
public record SuggestionHistoryFilter(
        SuggestionIntent intent,
        Jurisdiction jurisdiction,
        Instant startDate,
        Instant endDate,
        SuggestionStatus status
) {
    public static SuggestionHistoryFilter none() {
        return new SuggestionHistoryFilter(null, null, null, null, null);
    }
}
