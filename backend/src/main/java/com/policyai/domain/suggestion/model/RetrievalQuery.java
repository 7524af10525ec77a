package com.policyai.domain.suggestion.model;

import java.util.List;

/**
 * Parameters for one retrieval across the verified knowledge base.
 *
 * @param keywords          extracted context keywords, in original order
 * @param jurisdictions     documents must be tagged with at least one of these
 * @param standards         target standard codes; empty means no standards filter
 * @param minRelevanceScore documents scoring below this are dropped after merging
 * @param maxResults        upper bound on the merged result size
 * @param includeDeprecated whether deprecated material may be returned
 */
public record RetrievalQuery(
        List<String> keywords,
        List<Jurisdiction> jurisdictions,
        List<String> standards,
        double minRelevanceScore,
        int maxResults,
        boolean includeDeprecated
) {
    public RetrievalQuery {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        jurisdictions = jurisdictions == null ? List.of() : List.copyOf(jurisdictions);
        standards = standards == null ? List.of() : List.copyOf(standards);
    }
}
