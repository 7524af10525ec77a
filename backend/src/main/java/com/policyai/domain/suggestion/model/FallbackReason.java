package com.policyai.domain.suggestion.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FallbackReason {
    INSUFFICIENT_SOURCES("insufficient-sources"),
    LOW_CONFIDENCE("low-confidence"),
    SAFETY_VALIDATION_FAILED("safety-validation-failed"),
    SYSTEM_ERROR("system-error");

    private final String code;

    FallbackReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
