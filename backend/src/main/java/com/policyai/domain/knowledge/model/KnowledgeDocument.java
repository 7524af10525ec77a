package com.policyai.domain.knowledge.model;

import com.policyai.domain.suggestion.model.Jurisdiction;
import com.policyai.domain.suggestion.model.SourceType;
import com.policyai.domain.suggestion.model.VerificationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unscored document as returned by the knowledge store.
 */
public record KnowledgeDocument(
        SourceType sourceType,
        String id,
        String title,
        String content,
        String version,
        String section,
        Set<Jurisdiction> jurisdictions,
        List<String> standardCodes,
        VerificationStatus verificationStatus,
        Instant lastUpdated,
        Map<String, Object> metadata
) {}
