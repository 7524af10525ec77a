package com.policyai.domain.suggestion.repository;

import com.policyai.domain.suggestion.model.SuggestionIntent;
import com.policyai.domain.suggestion.model.SuggestionLog;
import com.policyai.domain.suggestion.model.SuggestionStatus;
import com.policyai.domain.suggestion.model.UserDecision;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only access to suggestion audit records. Exposes no delete or bulk-save operation.
 */
public interface SuggestionLogRepository extends Repository<SuggestionLog, String> {

    SuggestionLog save(SuggestionLog log);

    boolean existsById(String id);

    Optional<SuggestionLog> findById(String id);

    /**
     * A null argument disables its filter. {@code jurisdictionPattern} is a LIKE pattern over the
     * JSON-encoded jurisdictions column.
     */
    @Query("select l from SuggestionLog l where l.userId = :userId " +
            "and (:intent is null or l.intent = :intent) " +
            "and (:status is null or l.status = :status) " +
            "and (:startDate is null or l.createdAt >= :startDate) " +
            "and (:endDate is null or l.createdAt <= :endDate) " +
            "and (:jurisdictionPattern is null or cast(l.jurisdictions as String) like :jurisdictionPattern) " +
            "order by l.createdAt desc")
    List<SuggestionLog> findHistory(@Param("userId") String userId,
                                    @Param("intent") SuggestionIntent intent,
                                    @Param("status") SuggestionStatus status,
                                    @Param("startDate") Instant startDate,
                                    @Param("endDate") Instant endDate,
                                    @Param("jurisdictionPattern") String jurisdictionPattern);

    List<SuggestionLog> findByOrganizationIdAndCreatedAtBetween(String organizationId, Instant start, Instant end);

    /**
     * Compare-and-swap on the decision region: succeeds only while the decision is still PENDING
     * and only for the original requester.
     *
     * @return number of rows updated, 0 or 1
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update SuggestionLog l set l.decision.overrideDecision = :decision, " +
            "l.decision.modifiedContent = :modifiedContent, " +
            "l.decision.rejectionReason = :rejectionReason, " +
            "l.decision.decisionTimestamp = :decidedAt " +
            "where l.id = :id and l.userId = :userId " +
            "and l.decision.overrideDecision = com.policyai.domain.suggestion.model.UserDecision.PENDING")
    int updateDecisionIfPending(@Param("id") String id,
                                @Param("userId") String userId,
                                @Param("decision") UserDecision decision,
                                @Param("modifiedContent") String modifiedContent,
                                @Param("rejectionReason") String rejectionReason,
                                @Param("decidedAt") Instant decidedAt);
}
