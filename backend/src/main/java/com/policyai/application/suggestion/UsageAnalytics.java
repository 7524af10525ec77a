package com.policyai.application.suggestion;

import com.policyai.domain.suggestion.model.Jurisdiction;
import com.policyai.domain.suggestion.model.SuggestionIntent;

import java.util.Map;

/**
 * Aggregate suggestion usage for one organization over a time range.
 * Rates are percentages of {@code totalSuggestions}, rounded to two decimals.
 *
 * @param averageConfidence mean confidence over successful suggestions
 */
public record UsageAnalytics(
        long totalSuggestions,
        long successfulSuggestions,
        long fallbackCount,
        long errorCount,
        double successRate,
        double acceptanceRate,
        double modificationRate,
        double rejectionRate,
        double averageConfidence,
        Map<SuggestionIntent, Long> intentBreakdown,
        Map<Jurisdiction, Long> jurisdictionBreakdown,
        TimeRange timeRange
) {}
