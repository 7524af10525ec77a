package com.policyai.infrastructure.ai.pipeline;

import com.policyai.domain.suggestion.model.FallbackReason;
import com.policyai.domain.suggestion.model.RetrievedDocument;
import com.policyai.domain.suggestion.model.RoutedRequest;
import com.policyai.domain.suggestion.model.SafetyVerdict;
import com.policyai.domain.suggestion.model.SuggestionIntent;
import com.policyai.domain.suggestion.model.SuggestionRequest;
import com.policyai.domain.suggestion.model.SynthesizedSuggestion;
import com.policyai.domain.user.model.User;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one pipeline run. Each stage reads what earlier stages produced and records its own result.
 */
@Data
public class SuggestionPipelineContext {

    // --- Input ---
    private final SuggestionRequest request;
    private final User user;
    private final long startedNanos;

    private PipelineState state = PipelineState.START;

    // --- Authorization / routing ---
    private SuggestionIntent intent;
    private RoutedRequest routed;
    private String suggestionId;

    // --- Retrieval ---
    private List<String> keywords = new ArrayList<>();
    private List<RetrievedDocument> documents = new ArrayList<>();

    // --- Synthesis / safety ---
    private SynthesizedSuggestion synthesized;
    private SafetyVerdict safetyVerdict;

    // --- Outcome ---
    private FallbackReason fallbackReason;
    private RuntimeException error;

    public void transition(PipelineState next) {
        this.state = next;
    }

    public void fallback(FallbackReason reason) {
        this.fallbackReason = reason;
        this.state = PipelineState.FALLBACK;
    }

    public void fail(RuntimeException e) {
        this.error = e;
        fallback(FallbackReason.SYSTEM_ERROR);
    }

    /**
     * Errors raised before a suggestion id exists are caller errors and are not converted to fallbacks.
     */
    public boolean isRouted() {
        return suggestionId != null;
    }

    public long elapsedMs() {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
