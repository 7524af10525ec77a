package com.policyai.domain.suggestion.model;

import java.util.List;

/**
 * A single policy clause lifted from the highest-relevance source, with up to two supporting references.
 */
public record StructuredClause(
        String title,
        String content,
        String rationale,
        String primarySourceId,
        List<SupportingReference> supportingReferences
) implements SuggestionContent {

    public record SupportingReference(
            String sourceId,
            String title,
            String excerpt,
            double relevanceScore
    ) {}

    @Override
    public String toPlainText() {
        StringBuilder sb = new StringBuilder()
                .append(title).append('\n')
                .append(content).append('\n')
                .append(rationale);
        for (SupportingReference ref : supportingReferences) {
            sb.append('\n').append(ref.title()).append(": ").append(ref.excerpt());
        }
        return sb.toString();
    }
}
