package com.policyai.infrastructure.ai.retrieval;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordExtractorTest {

    private KeywordExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new KeywordExtractor();
    }

    @Test
    @DisplayName("Lowercases, strips punctuation and drops stop-words and short tokens")
    void extracts_keywords_in_original_order() {
        List<String> keywords = extractor.extract(
                "Please draft a Medication administration policy for the care home, ensuring staff training!");

        assertThat(keywords).containsExactly(
                "please", "draft", "medication", "administration", "policy", "care", "home", "ensuring", "staff", "training");
    }

    @Test
    @DisplayName("Modal and linking words of four letters or more are kept")
    void keeps_modal_words() {
        assertThat(extractor.extract("Staff must complete medication training with their manager"))
                .containsExactly("staff", "must", "complete", "medication", "training", "with", "their", "manager");
    }

    @Test
    void tokens_of_three_characters_or_fewer_are_dropped() {
        assertThat(extractor.extract("abc abcd de f")).containsExactly("abcd");
    }

    @Test
    void keeps_at_most_ten_keywords() {
        List<String> keywords = extractor.extract(
                "alpha bravo charlie delta echoes foxtrot golfing hotel india juliet kilo lima");

        assertThat(keywords).hasSize(KeywordExtractor.MAX_KEYWORDS);
        assertThat(keywords).startsWith("alpha", "bravo").endsWith("juliet");
    }

    @Test
    void blank_or_null_context_yields_no_keywords() {
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("   ")).isEmpty();
    }

    @Test
    void removes_invisible_characters_inside_words() {
        assertThat(extractor.extract("medi\u200Bcation")).containsExactly("medication");
    }

    @Test
    @DisplayName("Identical input always gives identical keywords")
    void extraction_is_deterministic() {
        String context = "Falls prevention and moving and handling risk assessment";

        assertThat(extractor.extract(context)).isEqualTo(extractor.extract(context));
    }
}
