package com.policyai.domain.suggestion.model;

import java.time.Instant;
import java.util.List;

public record ResponseMetadata(
        Instant generatedAt,
        long processingTimeMs,
        int retrievedDocuments,
        List<Jurisdiction> jurisdictionContext
) {}
