package com.policyai.domain.suggestion.model;

import java.util.List;

public record ImprovementList(
        List<Improvement> improvements
) implements SuggestionContent {

    /**
     * @param priority 1-based, in descending relevance order
     */
    public record Improvement(
            int priority,
            String sourceId,
            String title,
            String suggestion,
            RelevanceBand estimatedImpact
    ) {}

    @Override
    public String toPlainText() {
        StringBuilder sb = new StringBuilder();
        improvements.forEach(i -> sb.append(i.priority()).append(". ").append(i.title())
                .append(": ").append(i.suggestion()).append('\n'));
        return sb.toString().trim();
    }
}
