package com.policyai.domain.suggestion.model;

public enum SynthesisMethod {
    SINGLE_SOURCE,
    MULTI_SOURCE_MERGE,
    TEMPLATE_ASSEMBLY
}
