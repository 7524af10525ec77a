package com.policyai.domain.suggestion.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Assembled suggestion payload. One variant per {@link OutputFormat}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "format")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StructuredClause.class, name = "STRUCTURED_CLAUSE"),
        @JsonSubTypes.Type(value = MappingTable.class, name = "MAPPING_TABLE"),
        @JsonSubTypes.Type(value = ReviewReport.class, name = "REVIEW_REPORT"),
        @JsonSubTypes.Type(value = ImprovementList.class, name = "IMPROVEMENT_LIST")
})
public interface SuggestionContent {

    /**
     * Flattened text of everything the suggestion would show to the author.
     * Used for content-safety checks.
     */
    String toPlainText();
}
