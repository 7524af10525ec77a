package com.policyai.infrastructure.audit;

import com.policyai.domain.suggestion.model.DecisionUpdate;
import com.policyai.domain.suggestion.model.SuggestionHistoryFilter;
import com.policyai.domain.suggestion.model.SuggestionLog;
import com.policyai.domain.suggestion.repository.SuggestionLogRepository;
import com.policyai.domain.suggestion.service.AuditSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Audit sink backed by the ai_suggestion_logs table.
 * Records are inserted once; afterwards only the decision region can change, through a conditional update.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaAuditSink implements AuditSink {

    private final SuggestionLogRepository repository;

    @Override
    @Transactional
    public void append(SuggestionLog record) {
        if (repository.existsById(record.getId())) {
            throw new IllegalStateException("Suggestion record already exists: " + record.getId());
        }
        repository.save(record);
        log.debug("[Audit] Appended {} status={}", record.getId(), record.getStatus());
    }

    @Override
    @Transactional
    public boolean updateDecision(String suggestionId, String userId, DecisionUpdate update) {
        int updated = repository.updateDecisionIfPending(
                suggestionId,
                userId,
                update.decision(),
                update.modifiedContent(),
                update.rejectionReason(),
                update.decidedAt());
        return updated == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SuggestionLog> findById(String suggestionId) {
        return repository.findById(suggestionId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SuggestionLog> findByUser(String userId, SuggestionHistoryFilter filter) {
        return repository.findHistory(
                userId,
                filter.intent(),
                filter.status(),
                filter.startDate(),
                filter.endDate(),
                filter.jurisdiction() != null ? "%\"" + filter.jurisdiction().name() + "\"%" : null);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SuggestionLog> findByOrganization(String organizationId, Instant start, Instant end) {
        return repository.findByOrganizationIdAndCreatedAtBetween(organizationId, start, end);
    }
}
