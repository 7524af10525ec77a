package com.policyai.domain.suggestion.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A knowledge-base hit scored for one request. Never persisted.
 *
 * @param sourceType         which collection the document came from
 * @param id                 document id within its collection
 * @param title              document title
 * @param content            verbatim body text
 * @param version            document version label
 * @param section            optional section reference (nullable)
 * @param jurisdictions      jurisdictions the document applies to
 * @param standardCodes      standard codes the document carries or references
 * @param relevanceScore     keyword relevance in [0, 1]
 * @param verificationStatus verified, pending, or deprecated
 * @param lastUpdated        last-updated timestamp of the source
 * @param metadata           free-form source metadata
 */
public record RetrievedDocument(
        SourceType sourceType,
        String id,
        String title,
        String content,
        String version,
        String section,
        Set<Jurisdiction> jurisdictions,
        List<String> standardCodes,
        double relevanceScore,
        VerificationStatus verificationStatus,
        Instant lastUpdated,
        Map<String, Object> metadata
) {
    /**
     * Descending relevance; ties broken by source type, then id, so ordering is reproducible.
     */
    public static final Comparator<RetrievedDocument> BY_RELEVANCE =
            Comparator.comparingDouble(RetrievedDocument::relevanceScore).reversed()
                    .thenComparing(RetrievedDocument::sourceType)
                    .thenComparing(RetrievedDocument::id);

    public SourceReference toSourceReference() {
        return new SourceReference(sourceType, id, title, version, section, relevanceScore, verificationStatus);
    }
}
