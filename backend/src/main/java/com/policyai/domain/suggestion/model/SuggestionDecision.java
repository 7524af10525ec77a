package com.policyai.domain.suggestion.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The only mutable region of a {@link SuggestionLog}: the author's accept/modify/reject decision.
 * Written once as PENDING on creation, then updated at most once through the audit sink.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SuggestionDecision {

    @Enumerated(EnumType.STRING)
    @Column(name = "override_decision", nullable = false, length = 20)
    private UserDecision overrideDecision;

    @Column(name = "modified_content", columnDefinition = "TEXT")
    private String modifiedContent;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Column(name = "decision_timestamp")
    private Instant decisionTimestamp;

    private SuggestionDecision(UserDecision overrideDecision) {
        this.overrideDecision = overrideDecision;
    }

    public static SuggestionDecision pending() {
        return new SuggestionDecision(UserDecision.PENDING);
    }

    public boolean isPending() {
        return overrideDecision == UserDecision.PENDING;
    }
}
