package com.policyai.domain.suggestion.model;

public enum SafetyIssueType {
    EMPTY_CONTENT,
    PERSONAL_DATA,
    GENERATIVE_PHRASE,
    UNRESOLVED_PLACEHOLDER,
    ABSOLUTE_CLAIM
}
