package com.policyai.application.suggestion;

import com.policyai.application.suggestion.exception.DecisionAlreadyRecordedException;
import com.policyai.application.suggestion.exception.DecisionNotPermittedException;
import com.policyai.application.suggestion.exception.SuggestionNotFoundException;
import com.policyai.domain.suggestion.exception.SuggestionValidationException;
import com.policyai.domain.suggestion.model.DecisionUpdate;
import com.policyai.domain.suggestion.model.Jurisdiction;
import com.policyai.domain.suggestion.model.SuggestionHistoryFilter;
import com.policyai.domain.suggestion.model.SuggestionIntent;
import com.policyai.domain.suggestion.model.SuggestionLog;
import com.policyai.domain.suggestion.model.SuggestionRequest;
import com.policyai.domain.suggestion.model.SuggestionResponse;
import com.policyai.domain.suggestion.model.SuggestionStatus;
import com.policyai.domain.suggestion.model.UserDecision;
import com.policyai.domain.suggestion.service.AuditSink;
import com.policyai.domain.user.model.User;
import com.policyai.infrastructure.ai.pipeline.SuggestionPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

@Slf4j
@Service
@RequiredArgsConstructor
public class SuggestionAppService {

    private final SuggestionPipeline suggestionPipeline;
    private final AuditSink auditSink;

    /**
     * Runs the guarded suggestion pipeline.
     * Throws only for authorization and request validation failures; every other outcome is a response.
     */
    public SuggestionResponse generateSuggestion(SuggestionRequest request, User user) {
        return suggestionPipeline.execute(request, user);
    }

    /**
     * Records the requester's accept/modify/reject decision. A decision can be recorded once.
     */
    public void recordUserDecision(String suggestionId,
                                   String userId,
                                   UserDecision decision,
                                   String modifiedContent,
                                   String rejectionReason) {
        if (decision == null || decision == UserDecision.PENDING) {
            throw new SuggestionValidationException("Decision must be accepted, modified or rejected.");
        }

        SuggestionLog record = auditSink.findById(suggestionId)
                .orElseThrow(() -> new SuggestionNotFoundException(suggestionId));
        if (!record.getUserId().equals(userId)) {
            log.warn("[Decision] User {} attempted to decide suggestion {} owned by another user", userId, suggestionId);
            throw new DecisionNotPermittedException(suggestionId);
        }

        boolean recorded = auditSink.updateDecision(suggestionId, userId,
                new DecisionUpdate(decision, modifiedContent, rejectionReason, Instant.now()));
        if (!recorded) {
            throw new DecisionAlreadyRecordedException(suggestionId);
        }
        log.info("[Decision] [{}] {}", suggestionId, decision);
    }

    public List<SuggestionLog> getSuggestionHistory(String userId, SuggestionHistoryFilter filter) {
        return auditSink.findByUser(userId, filter != null ? filter : SuggestionHistoryFilter.none());
    }

    public UsageAnalytics getUsageAnalytics(String organizationId, TimeRange timeRange) {
        if (timeRange == null || timeRange.start() == null || timeRange.end() == null
                || timeRange.end().isBefore(timeRange.start())) {
            throw new SuggestionValidationException("A time range with start before end is required.");
        }

        List<SuggestionLog> records = auditSink.findByOrganization(organizationId, timeRange.start(), timeRange.end());
        long total = records.size();

        long successful = count(records, r -> r.getStatus() == SuggestionStatus.SUCCESS);
        long fallbacks = count(records, r -> r.getStatus() == SuggestionStatus.FALLBACK);
        long errors = count(records, r -> r.getStatus() == SuggestionStatus.ERROR);
        long accepted = count(records, r -> r.getDecision().getOverrideDecision() == UserDecision.ACCEPTED);
        long modified = count(records, r -> r.getDecision().getOverrideDecision() == UserDecision.MODIFIED);
        long rejected = count(records, r -> r.getDecision().getOverrideDecision() == UserDecision.REJECTED);

        double averageConfidence = records.stream()
                .filter(r -> r.getStatus() == SuggestionStatus.SUCCESS && r.getConfidence() != null)
                .mapToDouble(SuggestionLog::getConfidence)
                .average()
                .orElse(0.0);

        Map<SuggestionIntent, Long> intents = new EnumMap<>(SuggestionIntent.class);
        Map<Jurisdiction, Long> jurisdictions = new EnumMap<>(Jurisdiction.class);
        for (SuggestionLog record : records) {
            intents.merge(record.getIntent(), 1L, Long::sum);
            record.getJurisdictions().forEach(j -> jurisdictions.merge(j, 1L, Long::sum));
        }

        return new UsageAnalytics(
                total,
                successful,
                fallbacks,
                errors,
                percentage(successful, total),
                percentage(accepted, total),
                percentage(modified, total),
                percentage(rejected, total),
                round2(averageConfidence),
                intents,
                jurisdictions,
                timeRange
        );
    }

    private static long count(List<SuggestionLog> records, Predicate<SuggestionLog> predicate) {
        return records.stream().filter(predicate).count();
    }

    private static double percentage(long part, long total) {
        return total == 0 ? 0.0 : round2(part * 100.0 / total);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
