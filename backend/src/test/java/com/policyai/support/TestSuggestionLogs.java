package com.policyai.support;

import com.policyai.domain.suggestion.model.FallbackReason;
import com.policyai.domain.suggestion.model.Jurisdiction;
import com.policyai.domain.suggestion.model.RegulatoryContext;
import com.policyai.domain.suggestion.model.SuggestionIntent;
import com.policyai.domain.suggestion.model.SuggestionLog;
import com.policyai.domain.suggestion.model.SuggestionRequest;
import com.policyai.domain.suggestion.model.SuggestionResponse;
import com.policyai.domain.suggestion.model.SuggestionStatus;
import com.policyai.domain.suggestion.model.VerificationStatus;

import java.util.List;

public final class TestSuggestionLogs {

    private TestSuggestionLogs() {
    }

    public static SuggestionLog success(String id, String userId, double confidence) {
        return record(id, userId, SuggestionIntent.SUGGEST_CLAUSE, List.of(Jurisdiction.ENGLAND),
                SuggestionStatus.SUCCESS, confidence);
    }

    public static SuggestionLog record(String id,
                                       String userId,
                                       SuggestionIntent intent,
                                       List<Jurisdiction> jurisdictions,
                                       SuggestionStatus status,
                                       Double confidence) {
        return builder(id, userId, intent, jurisdictions, status, confidence).build();
    }

    /**
     * Builder pre-filled for organization {@code org-1}; callers may override any field.
     */
    public static SuggestionLog.SuggestionLogBuilder builder(String id,
                                                             String userId,
                                                             SuggestionIntent intent,
                                                             List<Jurisdiction> jurisdictions,
                                                             SuggestionStatus status,
                                                             Double confidence) {
        boolean succeeded = status == SuggestionStatus.SUCCESS;
        FallbackReason reason = switch (status) {
            case SUCCESS -> null;
            case FALLBACK -> FallbackReason.INSUFFICIENT_SOURCES;
            case ERROR -> FallbackReason.SYSTEM_ERROR;
        };
        SuggestionRequest prompt = new SuggestionRequest(intent.getValue(), "tpl-1", "pol-1",
                jurisdictions.stream().map(Jurisdiction::getDisplayName).toList(),
                "medication training", List.of(), "CARE_HOME_MANAGER", userId);
        return SuggestionLog.builder()
                .id(id)
                .userId(userId)
                .organizationId("org-1")
                .intent(intent)
                .jurisdictions(jurisdictions)
                .prompt(prompt)
                .response(succeeded ? null : SuggestionResponse.fallback(id, "Unavailable", null))
                .sourceReferences(List.of())
                .status(status)
                .fallbackReason(reason)
                .errorMessage(status == SuggestionStatus.ERROR ? "Knowledge retrieval failed" : null)
                .confidence(succeeded ? confidence : null)
                .regulatoryContext(new RegulatoryContext(jurisdictions, List.of()))
                .verificationStatus(succeeded ? VerificationStatus.VERIFIED : VerificationStatus.PENDING);
    }
}
