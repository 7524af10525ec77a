package com.policyai.infrastructure.audit;

import com.policyai.domain.suggestion.model.DecisionUpdate;
import com.policyai.domain.suggestion.model.Jurisdiction;
import com.policyai.domain.suggestion.model.ResponseMetadata;
import com.policyai.domain.suggestion.model.SourceReference;
import com.policyai.domain.suggestion.model.SourceType;
import com.policyai.domain.suggestion.model.StructuredClause;
import com.policyai.domain.suggestion.model.SuggestionHistoryFilter;
import com.policyai.domain.suggestion.model.SuggestionIntent;
import com.policyai.domain.suggestion.model.SuggestionLog;
import com.policyai.domain.suggestion.model.SuggestionResponse;
import com.policyai.domain.suggestion.model.SuggestionStatus;
import com.policyai.domain.suggestion.model.UserDecision;
import com.policyai.domain.suggestion.model.VerificationStatus;
import com.policyai.support.TestSuggestionLogs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(JpaAuditSink.class)
class JpaAuditSinkTest {

    @Autowired
    private JpaAuditSink auditSink;

    @Autowired
    private TestEntityManager entityManager;

    private static DecisionUpdate decision(UserDecision value) {
        return new DecisionUpdate(value, null, null, Instant.now());
    }

    @Test
    void appended_record_round_trips_its_json_columns() {
        SourceReference reference = new SourceReference(SourceType.POLICY_TEMPLATE, "T1", "Medication policy",
                "2.0", "4.1", 0.92, VerificationStatus.VERIFIED);
        StructuredClause clause = new StructuredClause("Medication policy",
                "Staff must complete medication training annually.",
                "Staff must complete medication training annually.", "T1",
                List.of(new StructuredClause.SupportingReference("T2", "Training policy", "Training is annual.", 0.8)));
        SuggestionResponse response = SuggestionResponse.success("s-json", clause, List.of(reference), 0.88, true,
                new ResponseMetadata(Instant.parse("2026-01-05T09:30:00Z"), 42, 2, List.of(Jurisdiction.ENGLAND)));
        SuggestionLog record = TestSuggestionLogs
                .builder("s-json", "user-1", SuggestionIntent.SUGGEST_CLAUSE, List.of(Jurisdiction.ENGLAND),
                        SuggestionStatus.SUCCESS, 0.88)
                .response(response)
                .sourceReferences(response.sourceReferences())
                .build();

        auditSink.append(record);
        entityManager.flush();
        entityManager.clear();

        SuggestionLog loaded = auditSink.findById("s-json").orElseThrow();
        assertThat(loaded.getResponse()).isEqualTo(response);
        assertThat(loaded.getSourceReferences()).containsExactly(reference);
        assertThat(loaded.getPrompt()).isEqualTo(record.getPrompt());
        assertThat(loaded.getJurisdictions()).containsExactly(Jurisdiction.ENGLAND);
        assertThat(loaded.getDecision().getOverrideDecision()).isEqualTo(UserDecision.PENDING);
    }

    @Test
    void duplicate_id_cannot_be_appended() {
        auditSink.append(TestSuggestionLogs.success("s-dup", "user-1", 0.9));

        assertThatThrownBy(() -> auditSink.append(TestSuggestionLogs.success("s-dup", "user-1", 0.95)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("s-dup");
    }

    @Test
    @DisplayName("A decision is recorded once, and only by the original requester")
    void decision_is_compare_and_set() {
        auditSink.append(TestSuggestionLogs.success("s-cas", "user-1", 0.9));
        entityManager.flush();

        assertThat(auditSink.updateDecision("s-cas", "user-2", decision(UserDecision.ACCEPTED))).isFalse();
        assertThat(auditSink.updateDecision("s-cas", "user-1",
                new DecisionUpdate(UserDecision.REJECTED, null, "Not specific to our home", Instant.now()))).isTrue();
        assertThat(auditSink.updateDecision("s-cas", "user-1", decision(UserDecision.ACCEPTED))).isFalse();

        SuggestionLog loaded = auditSink.findById("s-cas").orElseThrow();
        assertThat(loaded.getDecision().getOverrideDecision()).isEqualTo(UserDecision.REJECTED);
        assertThat(loaded.getDecision().getRejectionReason()).isEqualTo("Not specific to our home");
        assertThat(loaded.getDecision().getDecisionTimestamp()).isNotNull();
    }

    @Test
    @DisplayName("Changes to a managed record outside the decision region are never written")
    void audit_columns_are_not_updatable() {
        auditSink.append(TestSuggestionLogs.success("s-immutable", "user-1", 0.9));
        entityManager.flush();
        entityManager.clear();

        SuggestionLog managed = entityManager.find(SuggestionLog.class, "s-immutable");
        ReflectionTestUtils.setField(managed, "status", SuggestionStatus.ERROR);
        ReflectionTestUtils.setField(managed, "confidence", 0.1);
        entityManager.flush();
        entityManager.clear();

        SuggestionLog reloaded = entityManager.find(SuggestionLog.class, "s-immutable");
        assertThat(reloaded.getStatus()).isEqualTo(SuggestionStatus.SUCCESS);
        assertThat(reloaded.getConfidence()).isEqualTo(0.9);
    }

    @Test
    void finds_by_user_and_by_organization_period() {
        auditSink.append(TestSuggestionLogs.success("s-a", "user-a", 0.9));
        auditSink.append(TestSuggestionLogs.success("s-b", "user-b", 0.9));
        auditSink.append(TestSuggestionLogs.builder("s-c", "user-a", SuggestionIntent.MAP_POLICY,
                List.of(Jurisdiction.WALES), SuggestionStatus.FALLBACK, null).organizationId("org-2").build());
        entityManager.flush();

        assertThat(auditSink.findByUser("user-a", SuggestionHistoryFilter.none())).extracting(SuggestionLog::getId)
                .containsExactlyInAnyOrder("s-a", "s-c");
        Instant now = Instant.now();
        assertThat(auditSink.findByOrganization("org-1", now.minusSeconds(3600), now.plusSeconds(60)))
                .extracting(SuggestionLog::getId)
                .contains("s-a", "s-b")
                .doesNotContain("s-c");
        assertThat(auditSink.findByOrganization("org-1", now.plusSeconds(3600), now.plusSeconds(7200))).isEmpty();
    }

    @Test
    @DisplayName("History filters by intent, jurisdiction, status and inclusive date bounds, newest first")
    void history_filters_run_in_the_query() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        appendAt(TestSuggestionLogs.success("h-old", "user-h", 0.9), now.minusSeconds(7200));
        appendAt(TestSuggestionLogs.record("h-wales", "user-h", SuggestionIntent.MAP_POLICY,
                List.of(Jurisdiction.WALES), SuggestionStatus.FALLBACK, null), now.minusSeconds(3600));
        appendAt(TestSuggestionLogs.record("h-both", "user-h", SuggestionIntent.MAP_POLICY,
                List.of(Jurisdiction.ENGLAND, Jurisdiction.WALES), SuggestionStatus.SUCCESS, 0.8), now.minusSeconds(60));
        appendAt(TestSuggestionLogs.success("h-other", "user-other", 0.9), now.minusSeconds(60));
        entityManager.flush();
        entityManager.clear();

        assertThat(auditSink.findByUser("user-h", SuggestionHistoryFilter.none()))
                .extracting(SuggestionLog::getId).containsExactly("h-both", "h-wales", "h-old");
        assertThat(history(new SuggestionHistoryFilter(SuggestionIntent.MAP_POLICY, null, null, null, null)))
                .containsExactly("h-both", "h-wales");
        assertThat(history(new SuggestionHistoryFilter(null, Jurisdiction.WALES, null, null, null)))
                .containsExactly("h-both", "h-wales");
        assertThat(history(new SuggestionHistoryFilter(null, Jurisdiction.ENGLAND, null, null, SuggestionStatus.SUCCESS)))
                .containsExactly("h-both", "h-old");
        assertThat(history(new SuggestionHistoryFilter(null, null, now.minusSeconds(3600), now, null)))
                .containsExactly("h-both", "h-wales");
        assertThat(history(new SuggestionHistoryFilter(null, Jurisdiction.SCOTLAND, null, null, null))).isEmpty();
    }

    private void appendAt(SuggestionLog record, Instant createdAt) {
        ReflectionTestUtils.setField(record, "createdAt", createdAt);
        auditSink.append(record);
    }

    private List<String> history(SuggestionHistoryFilter filter) {
        return auditSink.findByUser("user-h", filter).stream().map(SuggestionLog::getId).toList();
    }
}
