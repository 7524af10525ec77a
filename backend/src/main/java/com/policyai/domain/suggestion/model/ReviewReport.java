package com.policyai.domain.suggestion.model;

import java.util.List;

public record ReviewReport(
        List<Finding> findings,
        List<Recommendation> recommendations,
        ComplianceStatus complianceStatus
) implements SuggestionContent {

    public enum ComplianceStatus {
        COMPLIANT,
        PARTIAL
    }

    public record Finding(
            String sourceId,
            String title,
            RelevanceBand severity,
            String excerpt,
            double relevanceScore
    ) {}

    public record Recommendation(
            int rank,
            String sourceId,
            String title,
            String excerpt
    ) {}

    @Override
    public String toPlainText() {
        StringBuilder sb = new StringBuilder();
        findings.forEach(f -> sb.append(f.title()).append(": ").append(f.excerpt()).append('\n'));
        recommendations.forEach(r -> sb.append(r.rank()).append(". ").append(r.excerpt()).append('\n'));
        return sb.toString().trim();
    }
}
