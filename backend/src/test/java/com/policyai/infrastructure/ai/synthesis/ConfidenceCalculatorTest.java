package com.policyai.infrastructure.ai.synthesis;

import com.policyai.domain.suggestion.model.RetrievedDocument;
import com.policyai.domain.suggestion.model.VerificationStatus;
import com.policyai.support.TestDocuments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

    private ConfidenceCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new ConfidenceCalculator(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static RetrievedDocument recent(String id, double score) {
        return TestDocuments.withLastUpdated(TestDocuments.template(id, score), NOW.minus(5, ChronoUnit.DAYS));
    }

    @Test
    void no_documents_means_zero_confidence() {
        assertThat(calculator.calculate(List.of())).isZero();
    }

    @Test
    @DisplayName("Five verified, recent documents averaging 0.9 score 0.96")
    void five_strong_documents() {
        List<RetrievedDocument> docs = List.of(
                recent("A", 0.9), recent("B", 0.9), recent("C", 0.9), recent("D", 0.9), recent("E", 0.9));

        // 0.9*0.4 + 1*0.3 + 1*0.2 + 1*0.1
        assertThat(calculator.calculate(docs)).isCloseTo(0.96, within(1e-9));
    }

    @Test
    void fewer_documents_reduce_the_count_factor() {
        List<RetrievedDocument> docs = List.of(recent("A", 0.8), recent("B", 0.8));

        // 0.8*0.4 + 0.4*0.3 + 0.2 + 0.1
        assertThat(calculator.calculate(docs)).isCloseTo(0.74, within(1e-9));
    }

    @Test
    void unverified_and_stale_documents_reduce_confidence() {
        RetrievedDocument pending = TestDocuments.withStatus(recent("A", 1.0), VerificationStatus.PENDING);
        RetrievedDocument stale = TestDocuments.withLastUpdated(TestDocuments.template("B", 1.0),
                NOW.minus(400, ChronoUnit.DAYS));

        // 1.0*0.4 + 0.4*0.3 + 0.5*0.2 + 0.5*0.1
        assertThat(calculator.calculate(List.of(pending, stale))).isCloseTo(0.67, within(1e-9));
    }

    @Test
    void warnings_cover_low_confidence_single_source_deprecated_and_stale() {
        RetrievedDocument old = TestDocuments.withStatus(
                TestDocuments.withLastUpdated(TestDocuments.template("OLD", 0.7), NOW.minus(800, ChronoUnit.DAYS)),
                VerificationStatus.DEPRECATED);
        List<RetrievedDocument> docs = List.of(old);

        List<String> warnings = calculator.warnings(docs, calculator.calculate(docs));

        assertThat(warnings).hasSize(4);
        assertThat(warnings.get(0)).contains("human review strongly recommended");
        assertThat(warnings.get(1)).contains("Only 1 source");
        assertThat(warnings.get(2)).contains("deprecated").contains("OLD");
        assertThat(warnings.get(3)).contains("365 days").contains("OLD");
    }

    @Test
    void strong_sources_produce_no_warnings() {
        List<RetrievedDocument> docs = List.of(recent("A", 0.9), recent("B", 0.9), recent("C", 0.9));

        assertThat(calculator.warnings(docs, calculator.calculate(docs))).isEmpty();
    }
}
