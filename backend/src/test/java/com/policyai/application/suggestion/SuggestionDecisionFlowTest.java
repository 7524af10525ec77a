package com.policyai.application.suggestion;

import com.policyai.application.suggestion.exception.DecisionAlreadyRecordedException;
import com.policyai.domain.suggestion.model.Jurisdiction;
import com.policyai.domain.suggestion.model.SuggestionIntent;
import com.policyai.domain.suggestion.model.SuggestionLog;
import com.policyai.domain.suggestion.model.SuggestionStatus;
import com.policyai.domain.suggestion.model.UserDecision;
import com.policyai.domain.suggestion.service.AuditSink;
import com.policyai.infrastructure.ai.pipeline.SuggestionPipeline;
import com.policyai.infrastructure.audit.JpaAuditSink;
import com.policyai.support.TestSuggestionLogs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Decision recording against a real database, with each call committing on its own.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({JpaAuditSink.class, SuggestionAppService.class})
class SuggestionDecisionFlowTest {

    @MockBean
    private SuggestionPipeline suggestionPipeline;

    @Autowired
    private SuggestionAppService service;

    @Autowired
    private AuditSink auditSink;

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    @Test
    @DisplayName("Two concurrent decisions on one suggestion: exactly one is recorded")
    void concurrent_decisions_record_exactly_one() throws Exception {
        String id = newId();
        auditSink.append(TestSuggestionLogs.success(id, "user-1", 0.9));
        SuggestionLog before = auditSink.findById(id).orElseThrow();

        CountDownLatch start = new CountDownLatch(1);
        List<UserDecision> recorded = Collections.synchronizedList(new ArrayList<>());
        List<Throwable> rejected = Collections.synchronizedList(new ArrayList<>());
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (UserDecision decision : List.of(UserDecision.ACCEPTED, UserDecision.REJECTED)) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        service.recordUserDecision(id, "user-1", decision, null,
                                decision == UserDecision.REJECTED ? "Not applicable" : null);
                        recorded.add(decision);
                    } catch (DecisionAlreadyRecordedException e) {
                        rejected.add(e);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(recorded).hasSize(1);
        assertThat(rejected).hasSize(1);

        SuggestionLog after = auditSink.findById(id).orElseThrow();
        assertThat(after.getDecision().getOverrideDecision()).isEqualTo(recorded.get(0));
        assertThat(after.getStatus()).isEqualTo(before.getStatus());
        assertThat(after.getConfidence()).isEqualTo(before.getConfidence());
        assertThat(after.getPrompt()).isEqualTo(before.getPrompt());
        assertThat(after.getCreatedAt()).isEqualTo(before.getCreatedAt());
    }

    @Test
    void decisions_feed_usage_analytics() {
        String organization = "org-" + newId();
        List<String> ids = List.of(newId(), newId(), newId(), newId());
        for (String id : ids) {
            auditSink.append(TestSuggestionLogs.builder(id, "user-1", SuggestionIntent.SUGGEST_CLAUSE,
                            List.of(Jurisdiction.ENGLAND), SuggestionStatus.SUCCESS, 0.9)
                    .organizationId(organization)
                    .build());
        }

        service.recordUserDecision(ids.get(0), "user-1", UserDecision.ACCEPTED, null, null);
        service.recordUserDecision(ids.get(1), "user-1", UserDecision.MODIFIED, "Edited", null);
        service.recordUserDecision(ids.get(2), "user-1", UserDecision.REJECTED, null, "Too generic");

        Instant now = Instant.now();
        UsageAnalytics analytics = service.getUsageAnalytics(organization,
                new TimeRange(now.minusSeconds(3600), now.plusSeconds(60)));

        assertThat(analytics.totalSuggestions()).isEqualTo(4);
        assertThat(analytics.acceptanceRate()).isEqualTo(25.0);
        assertThat(analytics.modificationRate()).isEqualTo(25.0);
        assertThat(analytics.rejectionRate()).isEqualTo(25.0);
        assertThat(analytics.successRate()).isEqualTo(100.0);
        assertThat(analytics.averageConfidence()).isEqualTo(0.9);
    }
}
