package com.policyai.domain.suggestion.model;

/**
 * Citation for one document a suggestion was assembled from.
 */
public record SourceReference(
        SourceType type,
        String id,
        String title,
        String version,
        String section,
        double relevanceScore,
        VerificationStatus verificationStatus
) {}
