package com.policyai.domain.suggestion.model;

import java.util.List;

/**
 * Policy-to-standards mapping.
 *
 * @param rows     one row per retrieved compliance standard
 * @param coverage fraction of requested standards found among the retrieved standards
 * @param gaps     requested standard codes with no retrieved standard
 */
public record MappingTable(
        List<MappingRow> rows,
        double coverage,
        List<String> gaps
) implements SuggestionContent {

    public record MappingRow(
            String standardCode,
            String standardTitle,
            String sourceId,
            List<String> clauses,
            double relevanceScore
    ) {}

    @Override
    public String toPlainText() {
        StringBuilder sb = new StringBuilder();
        for (MappingRow row : rows) {
            sb.append(row.standardCode()).append(' ').append(row.standardTitle()).append('\n');
            row.clauses().forEach(c -> sb.append("- ").append(c).append('\n'));
        }
        return sb.toString().trim();
    }
}
