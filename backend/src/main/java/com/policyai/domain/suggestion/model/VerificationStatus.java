package com.policyai.domain.suggestion.model;

public enum VerificationStatus {
    VERIFIED,
    PENDING,
    DEPRECATED
}
