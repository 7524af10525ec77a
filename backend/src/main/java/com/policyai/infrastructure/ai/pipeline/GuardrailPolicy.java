package com.policyai.infrastructure.ai.pipeline;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Deployment-tunable guardrail thresholds and retrieval limits.
 */
@Component
public class GuardrailPolicy {

    private final int minSources;
    private final double minConfidence;
    private final double minSafetyConfidence;
    private final double humanReviewBelow;
    private final double minRelevance;
    private final int maxResults;

    public GuardrailPolicy(@Value("${suggestion.guardrail.min-sources:2}") int minSources,
                           @Value("${suggestion.guardrail.min-confidence:0.75}") double minConfidence,
                           @Value("${suggestion.guardrail.min-safety-confidence:0.7}") double minSafetyConfidence,
                           @Value("${suggestion.guardrail.human-review-below:0.9}") double humanReviewBelow,
                           @Value("${suggestion.retrieval.min-relevance:0.7}") double minRelevance,
                           @Value("${suggestion.retrieval.max-results:10}") int maxResults) {
        this.minSources = minSources;
        this.minConfidence = minConfidence;
        this.minSafetyConfidence = minSafetyConfidence;
        this.humanReviewBelow = humanReviewBelow;
        this.minRelevance = minRelevance;
        this.maxResults = maxResults;
    }

    public static GuardrailPolicy defaults() {
        return new GuardrailPolicy(2, 0.75, 0.7, 0.9, 0.7, 10);
    }

    public boolean hasEnoughSources(int documentCount) {
        return documentCount >= minSources;
    }

    public boolean meetsConfidenceFloor(double confidence) {
        return confidence >= minConfidence;
    }

    public boolean meetsSafetyFloor(boolean safe, double safetyConfidence) {
        return safe && safetyConfidence >= minSafetyConfidence;
    }

    public boolean requiresHumanReview(double confidence) {
        return confidence < humanReviewBelow;
    }

    public int getMinSources() {
        return minSources;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public double getMinSafetyConfidence() {
        return minSafetyConfidence;
    }

    public double getMinRelevance() {
        return minRelevance;
    }

    public int getMaxResults() {
        return maxResults;
    }
}
