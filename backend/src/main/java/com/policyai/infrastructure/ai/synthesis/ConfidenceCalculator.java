package com.policyai.infrastructure.ai.synthesis;

import com.policyai.domain.suggestion.model.RetrievedDocument;
import com.policyai.domain.suggestion.model.VerificationStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Composite confidence over the documents a suggestion was assembled from:
 * <pre>
 *   0.4 × mean relevance
 * + 0.3 × min(n / 5, 1)
 * + 0.2 × verified / n
 * + 0.1 × updated within a year / n
 * </pre>
 */
@Component
public class ConfidenceCalculator {

    static final double REVIEW_RECOMMENDED_BELOW = 0.7;
    static final int FULL_COUNT = 5;
    static final Duration STALE_AFTER = Duration.ofDays(365);

    private final Clock clock;

    public ConfidenceCalculator() {
        this(Clock.systemUTC());
    }

    ConfidenceCalculator(Clock clock) {
        this.clock = clock;
    }

    public double calculate(List<RetrievedDocument> documents) {
        if (documents.isEmpty()) {
            return 0.0;
        }
        int n = documents.size();
        Instant cutoff = clock.instant().minus(STALE_AFTER);

        double meanRelevance = documents.stream()
                .mapToDouble(RetrievedDocument::relevanceScore)
                .average()
                .orElse(0.0);
        double countFactor = Math.min((double) n / FULL_COUNT, 1.0);
        double verifiedRatio = (double) documents.stream()
                .filter(doc -> doc.verificationStatus() == VerificationStatus.VERIFIED)
                .count() / n;
        double recentRatio = (double) documents.stream()
                .filter(doc -> !isStale(doc, cutoff))
                .count() / n;

        double confidence = meanRelevance * 0.4 + countFactor * 0.3 + verifiedRatio * 0.2 + recentRatio * 0.1;
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    public List<String> warnings(List<RetrievedDocument> documents, double confidence) {
        List<String> warnings = new ArrayList<>();
        Instant cutoff = clock.instant().minus(STALE_AFTER);

        if (confidence < REVIEW_RECOMMENDED_BELOW) {
            warnings.add(String.format(Locale.ROOT,
                    "Low confidence (%.2f): human review strongly recommended", confidence));
        }
        if (documents.size() < 2) {
            warnings.add("Only " + documents.size() + " source document(s) available");
        }

        List<String> deprecated = documents.stream()
                .filter(doc -> doc.verificationStatus() == VerificationStatus.DEPRECATED)
                .map(RetrievedDocument::id)
                .toList();
        if (!deprecated.isEmpty()) {
            warnings.add("Includes deprecated sources: " + String.join(", ", deprecated));
        }

        List<String> stale = documents.stream()
                .filter(doc -> isStale(doc, cutoff))
                .map(RetrievedDocument::id)
                .toList();
        if (!stale.isEmpty()) {
            warnings.add("Includes sources not updated in over 365 days: " + String.join(", ", stale));
        }
        return warnings;
    }

    // Unknown last-updated counts as stale
    private static boolean isStale(RetrievedDocument doc, Instant cutoff) {
        return doc.lastUpdated() == null || doc.lastUpdated().isBefore(cutoff);
    }
}
