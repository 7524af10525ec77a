package com.policyai.domain.suggestion.model;

public enum SourceType {
    POLICY_TEMPLATE,
    COMPLIANCE_STANDARD,
    JURISDICTIONAL_RULE,
    BEST_PRACTICE
}
