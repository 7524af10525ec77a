package com.policyai;

import com.policyai.application.suggestion.SuggestionAppService;
import com.policyai.domain.knowledge.model.ComplianceStandard;
import com.policyai.domain.knowledge.model.JurisdictionalRule;
import com.policyai.domain.knowledge.model.PolicyTemplate;
import com.policyai.domain.knowledge.repository.ComplianceStandardRepository;
import com.policyai.domain.knowledge.repository.JurisdictionalRuleRepository;
import com.policyai.domain.knowledge.repository.PolicyTemplateRepository;
import com.policyai.domain.suggestion.model.FallbackReason;
import com.policyai.domain.suggestion.model.Jurisdiction;
import com.policyai.domain.suggestion.model.StructuredClause;
import com.policyai.domain.suggestion.model.SuggestionLog;
import com.policyai.domain.suggestion.model.SuggestionRequest;
import com.policyai.domain.suggestion.model.SuggestionResponse;
import com.policyai.domain.suggestion.model.SuggestionStatus;
import com.policyai.domain.suggestion.service.AuditSink;
import com.policyai.domain.user.model.User;
import com.policyai.domain.user.model.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest
class PolicyAiApplicationTests {

    private static final String MEDICATION_TEXT =
            "Medication administration training must be completed by all staff before they administer medication. "
                    + "The purpose of medication administration training is to ensure safe practice.";

    @Autowired
    private SuggestionAppService suggestionAppService;

    @Autowired
    private AuditSink auditSink;

    @Autowired
    private PolicyTemplateRepository templateRepository;

    @Autowired
    private ComplianceStandardRepository standardRepository;

    @Autowired
    private JurisdictionalRuleRepository ruleRepository;

    private final User manager = new User("manager-1", UserRole.CARE_HOME_MANAGER, "home-1");

    @BeforeEach
    void seedKnowledgeBase() {
        templateRepository.save(PolicyTemplate.builder()
                .id("tpl-medication").title("Medication administration policy").content(MEDICATION_TEXT)
                .version("3.0").category("clinical").jurisdictions(Set.of(Jurisdiction.ENGLAND))
                .build());
        standardRepository.save(ComplianceStandard.builder()
                .id("std-reg12").title("Regulation 12: Medication administration").content(MEDICATION_TEXT)
                .version("2014").code("REG12").regulator("CQC").jurisdictions(Set.of(Jurisdiction.ENGLAND))
                .build());
        ruleRepository.save(JurisdictionalRule.builder()
                .id("rule-medication").title("Medication administration training").content(MEDICATION_TEXT)
                .version("1.0").regulatoryBody("CQC").mandatory(true).jurisdictions(Set.of(Jurisdiction.ENGLAND))
                .build());
    }

    private static SuggestionRequest clauseRequest(String context) {
        return new SuggestionRequest("suggest-clause", "tpl-medication", null, List.of("England"),
                context, List.of(), "CARE_HOME_MANAGER", "manager-1");
    }

    @Test
    void suggests_a_clause_from_verified_sources_and_audits_it() {
        SuggestionResponse response = suggestionAppService.generateSuggestion(
                clauseRequest("Medication administration training"), manager);

        assertThat(response.fallbackUsed()).isFalse();
        assertThat(response.confidence()).isCloseTo(0.88, within(1e-9));
        assertThat(response.requiresHumanReview()).isTrue();
        assertThat(response.sourceReferences()).hasSize(3);
        StructuredClause clause = (StructuredClause) response.suggestion();
        assertThat(MEDICATION_TEXT).contains(clause.content());

        SuggestionLog record = auditSink.findById(response.id()).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(SuggestionStatus.SUCCESS);
        assertThat(record.getUserId()).isEqualTo("manager-1");
        assertThat(record.getResponse()).isEqualTo(response);
    }

    @Test
    void falls_back_when_nothing_in_the_knowledge_base_matches() {
        SuggestionResponse response = suggestionAppService.generateSuggestion(
                clauseRequest("Visiting arrangements for relatives"), manager);

        assertThat(response.fallbackUsed()).isTrue();
        assertThat(response.suggestion()).isNull();
        assertThat(response.metadata().retrievedDocuments()).isZero();

        SuggestionLog record = auditSink.findById(response.id()).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(SuggestionStatus.FALLBACK);
        assertThat(record.getFallbackReason()).isEqualTo(FallbackReason.INSUFFICIENT_SOURCES);
    }
}
