package com.policyai.domain.suggestion.model;

/**
 * Shape of the assembled suggestion. Bound once per request by the prompt router.
 */
public enum OutputFormat {
    STRUCTURED_CLAUSE,
    MAPPING_TABLE,
    REVIEW_REPORT,
    IMPROVEMENT_LIST
}
