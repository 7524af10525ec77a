package com.policyai.domain.suggestion.model;

import java.util.List;

/**
 * Safe, non-authoritative answer produced when a guardrail trips. Carries no policy content.
 */
public record FallbackResponse(
        FallbackReason reason,
        String message,
        List<String> suggestedActions,
        boolean escalationRequired,
        boolean contactComplianceOfficer
) {}
