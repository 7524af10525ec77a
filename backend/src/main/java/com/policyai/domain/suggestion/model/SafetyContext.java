package com.policyai.domain.suggestion.model;

import java.util.List;

/**
 * @param category           first requested standard code, or "general"
 * @param criticalCompliance always true for policy suggestions
 */
public record SafetyContext(
        List<Jurisdiction> jurisdictions,
        String category,
        boolean criticalCompliance
) {}
