package com.policyai.domain.suggestion.model;

public enum UserDecision {
    PENDING,
    ACCEPTED,
    MODIFIED,
    REJECTED
}
