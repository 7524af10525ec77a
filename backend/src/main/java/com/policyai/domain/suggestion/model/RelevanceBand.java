package com.policyai.domain.suggestion.model;

/**
 * Coarse banding of a relevance score, used for finding severity and improvement impact.
 */
public enum RelevanceBand {
    HIGH,
    MEDIUM,
    LOW;

    public static RelevanceBand of(double relevanceScore) {
        if (relevanceScore > 0.8) {
            return HIGH;
        }
        if (relevanceScore > 0.6) {
            return MEDIUM;
        }
        return LOW;
    }
}
