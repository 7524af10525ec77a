package com.policyai.domain.suggestion.model;

import com.policyai.domain.suggestion.model.converter.JurisdictionListConverter;
import com.policyai.domain.suggestion.model.converter.RegulatoryContextConverter;
import com.policyai.domain.suggestion.model.converter.SourceReferenceListConverter;
import com.policyai.domain.suggestion.model.converter.SuggestionRequestConverter;
import com.policyai.domain.suggestion.model.converter.SuggestionResponseConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Immutable audit record of one suggestion request and its outcome.
 * <p>
 * Every column outside {@link SuggestionDecision} is {@code updatable = false}, so Hibernate never
 * issues an UPDATE for them even if a managed instance is flushed. The decision region is changed
 * only through {@code SuggestionLogRepository#updateDecisionIfPending}.
 * </p>
 */
@Entity
@Table(name = "ai_suggestion_logs", indexes = {
        @Index(name = "idx_suggestion_user", columnList = "user_id"),
        @Index(name = "idx_suggestion_org_created", columnList = "organization_id, created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SuggestionLog {

    @Id
    @Column(length = 36, updatable = false)
    private String id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "organization_id", updatable = false, length = 64)
    private String organizationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 30)
    private SuggestionIntent intent;

    @Convert(converter = JurisdictionListConverter.class)
    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private List<Jurisdiction> jurisdictions;

    @Convert(converter = SuggestionRequestConverter.class)
    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private SuggestionRequest prompt;

    @Convert(converter = SuggestionResponseConverter.class)
    @Column(updatable = false, columnDefinition = "TEXT")
    private SuggestionResponse response;

    @Convert(converter = SourceReferenceListConverter.class)
    @Column(name = "source_references", nullable = false, updatable = false, columnDefinition = "TEXT")
    private List<SourceReference> sourceReferences;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private SuggestionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "fallback_reason", updatable = false, length = 30)
    private FallbackReason fallbackReason;

    @Column(name = "error_message", updatable = false, columnDefinition = "TEXT")
    private String errorMessage;

    @Column(updatable = false)
    private Double confidence;

    @Convert(converter = RegulatoryContextConverter.class)
    @Column(name = "regulatory_context", nullable = false, updatable = false, columnDefinition = "TEXT")
    private RegulatoryContext regulatoryContext;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", nullable = false, updatable = false, length = 20)
    private VerificationStatus verificationStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Embedded
    private SuggestionDecision decision;

    @Builder
    public SuggestionLog(String id,
                         String userId,
                         String organizationId,
                         SuggestionIntent intent,
                         List<Jurisdiction> jurisdictions,
                         SuggestionRequest prompt,
                         SuggestionResponse response,
                         List<SourceReference> sourceReferences,
                         SuggestionStatus status,
                         FallbackReason fallbackReason,
                         String errorMessage,
                         Double confidence,
                         RegulatoryContext regulatoryContext,
                         VerificationStatus verificationStatus) {
        this.id = id;
        this.userId = userId;
        this.organizationId = organizationId;
        this.intent = intent;
        this.jurisdictions = List.copyOf(jurisdictions);
        this.prompt = prompt;
        this.response = response;
        this.sourceReferences = sourceReferences == null ? List.of() : List.copyOf(sourceReferences);
        this.status = status;
        this.fallbackReason = fallbackReason;
        this.errorMessage = errorMessage;
        this.confidence = confidence;
        this.regulatoryContext = regulatoryContext;
        this.verificationStatus = verificationStatus;
        this.createdAt = Instant.now();
        this.decision = SuggestionDecision.pending();
    }
}
