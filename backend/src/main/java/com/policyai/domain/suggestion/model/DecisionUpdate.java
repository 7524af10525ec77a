package com.policyai.domain.suggestion.model;

import java.time.Instant;

/**
 * Values written into the decision region of a suggestion log.
 */
public record DecisionUpdate(
        UserDecision decision,
        String modifiedContent,
        String rejectionReason,
        Instant decidedAt
) {}
