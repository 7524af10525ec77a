package com.policyai.infrastructure.ai.retrieval;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RelevanceScorerTest {

    private RelevanceScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new RelevanceScorer();
    }

    @Test
    void no_keywords_scores_default() {
        assertThat(scorer.score("Anything", "at all", List.of())).isEqualTo(0.8);
    }

    @Test
    void all_keywords_with_dense_occurrences_scores_one() {
        double score = scorer.score("Medication policy",
                "Staff must record medication. Policy review annually.",
                List.of("medication", "policy"));

        assertThat(score).isEqualTo(1.0);
    }

    @Test
    void partial_match_combines_fraction_and_density() {
        // 20 words, 1 occurrence: 0.6 * 1/2 + 4 * 1/20
        double score = scorer.score("Medication",
                "one two three four five six seven eight nine ten eleven twelve thirteen fourteen "
                        + "fifteen sixteen seventeen eighteen nineteen",
                List.of("medication", "falls"));

        assertThat(score).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void no_matching_keyword_scores_zero() {
        assertThat(scorer.score("Visiting hours", "Visitors may attend daily.", List.of("medication")))
                .isEqualTo(0.0);
    }

    @Test
    void matching_is_case_insensitive() {
        assertThat(scorer.score("MEDICATION", "", List.of("medication"))).isEqualTo(1.0);
    }
}
