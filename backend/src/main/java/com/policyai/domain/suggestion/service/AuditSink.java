package com.policyai.domain.suggestion.service;

import com.policyai.domain.suggestion.model.DecisionUpdate;
import com.policyai.domain.suggestion.model.SuggestionHistoryFilter;
import com.policyai.domain.suggestion.model.SuggestionLog;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of suggestion audit records.
 */
public interface AuditSink {

    /**
     * Writes a new record. Fails if a record with the same id already exists.
     */
    void append(SuggestionLog record);

    /**
     * Sets the decision region of a record, provided it is still pending and owned by {@code userId}.
     *
     * @return true if this call recorded the decision, false if the record was already decided
     *         or belongs to someone else
     */
    boolean updateDecision(String suggestionId, String userId, DecisionUpdate update);

    Optional<SuggestionLog> findById(String suggestionId);

    /**
     * The user's records matching every non-null field of {@code filter}, newest first.
     */
    List<SuggestionLog> findByUser(String userId, SuggestionHistoryFilter filter);

    List<SuggestionLog> findByOrganization(String organizationId, Instant start, Instant end);
}
