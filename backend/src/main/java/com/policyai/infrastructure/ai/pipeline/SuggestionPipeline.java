package com.policyai.infrastructure.ai.pipeline;

import com.policyai.domain.suggestion.exception.SuggestionAuditException;
import com.policyai.domain.suggestion.exception.SuggestionValidationException;
import com.policyai.domain.suggestion.model.FallbackReason;
import com.policyai.domain.suggestion.model.FallbackResponse;
import com.policyai.domain.suggestion.model.RegulatoryContext;
import com.policyai.domain.suggestion.model.ResponseMetadata;
import com.policyai.domain.suggestion.model.RetrievalQuery;
import com.policyai.domain.suggestion.model.RetrievedDocument;
import com.policyai.domain.suggestion.model.RoutedRequest;
import com.policyai.domain.suggestion.model.SafetyContext;
import com.policyai.domain.suggestion.model.SafetyVerdict;
import com.policyai.domain.suggestion.model.SourceReference;
import com.policyai.domain.suggestion.model.SuggestionIntent;
import com.policyai.domain.suggestion.model.SuggestionLog;
import com.policyai.domain.suggestion.model.SuggestionRequest;
import com.policyai.domain.suggestion.model.SuggestionResponse;
import com.policyai.domain.suggestion.model.SuggestionStatus;
import com.policyai.domain.suggestion.model.SynthesizedSuggestion;
import com.policyai.domain.suggestion.model.TransparencyEvent;
import com.policyai.domain.suggestion.model.VerificationStatus;
import com.policyai.domain.suggestion.service.AuditSink;
import com.policyai.domain.suggestion.service.ContentSafetyValidator;
import com.policyai.domain.suggestion.service.RoleGuard;
import com.policyai.domain.suggestion.service.TransparencyLogger;
import com.policyai.domain.user.model.User;
import com.policyai.infrastructure.ai.fallback.FallbackHandler;
import com.policyai.infrastructure.ai.retrieval.KeywordExtractor;
import com.policyai.infrastructure.ai.retrieval.VerifiedRetriever;
import com.policyai.infrastructure.ai.synthesis.ClauseSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Guarded suggestion pipeline.
 * <pre>
 * START → AUTHORIZED → ROUTED → RETRIEVED → SOURCES_CONFIRMED → SYNTHESIZED
 *       → CONFIDENCE_CONFIRMED → SAFETY_CONFIRMED → SUCCESS
 * </pre>
 * Any guardrail failure moves to FALLBACK. Errors before routing (authorization, validation)
 * propagate to the caller; any error after routing becomes a system-error FALLBACK.
 * Both terminal states write exactly one audit record, then emit a best-effort transparency event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SuggestionPipeline {

    private final RoleGuard roleGuard;
    private final PromptOrchestrator promptOrchestrator;
    private final KeywordExtractor keywordExtractor;
    private final VerifiedRetriever retriever;
    private final ClauseSynthesizer synthesizer;
    private final ContentSafetyValidator safetyValidator;
    private final FallbackHandler fallbackHandler;
    private final AuditSink auditSink;
    private final TransparencyLogger transparencyLogger;
    private final GuardrailPolicy policy;

    public SuggestionResponse execute(SuggestionRequest request, User user) {
        SuggestionPipelineContext ctx = new SuggestionPipelineContext(request, user, System.nanoTime());

        while (!ctx.getState().isTerminal()) {
            try {
                advance(ctx);
            } catch (RuntimeException e) {
                if (!ctx.isRouted()) {
                    throw e;
                }
                log.error("[Suggestion] [{}] System error in state {}", ctx.getSuggestionId(), ctx.getState(), e);
                ctx.fail(e);
            }
        }

        SuggestionResponse response = finish(ctx);
        emitTransparencyEvent(ctx, response);
        return response;
    }

    /**
     * Runs the stage for the current state and moves to the next one.
     */
    void advance(SuggestionPipelineContext ctx) {
        switch (ctx.getState()) {
            case START -> authorize(ctx);
            case AUTHORIZED -> route(ctx);
            case ROUTED -> retrieve(ctx);
            case RETRIEVED -> checkSources(ctx);
            case SOURCES_CONFIRMED -> synthesize(ctx);
            case SYNTHESIZED -> checkConfidence(ctx);
            case CONFIDENCE_CONFIRMED -> checkSafety(ctx);
            case SAFETY_CONFIRMED -> ctx.transition(PipelineState.SUCCESS);
            case SUCCESS, FALLBACK -> throw new IllegalStateException("Pipeline already finished: " + ctx.getState());
        }
    }

    // ===== Stages =====

    private void authorize(SuggestionPipelineContext ctx) {
        String rawIntent = ctx.getRequest() != null ? ctx.getRequest().intent() : null;
        if (rawIntent == null || rawIntent.isBlank()) {
            throw new SuggestionValidationException("Intent is required.");
        }
        SuggestionIntent intent = SuggestionIntent.fromValue(rawIntent)
                .orElseThrow(() -> new SuggestionValidationException("Unsupported intent: " + rawIntent));
        roleGuard.authorize(ctx.getUser(), intent);
        ctx.setIntent(intent);
        ctx.transition(PipelineState.AUTHORIZED);
    }

    private void route(SuggestionPipelineContext ctx) {
        RoutedRequest routed = promptOrchestrator.route(ctx.getRequest());
        ctx.setRouted(routed);
        ctx.setSuggestionId(UUID.randomUUID().toString());
        log.info("[Suggestion] [{}] Routed intent={} format={} jurisdictions={}",
                ctx.getSuggestionId(), routed.intent().getValue(), routed.outputFormat(), routed.jurisdictions());
        ctx.transition(PipelineState.ROUTED);
    }

    private void retrieve(SuggestionPipelineContext ctx) {
        RoutedRequest routed = ctx.getRouted();
        List<String> keywords = keywordExtractor.extract(routed.context());
        ctx.setKeywords(keywords);

        RetrievalQuery query = new RetrievalQuery(
                keywords,
                routed.jurisdictions(),
                routed.standards(),
                policy.getMinRelevance(),
                policy.getMaxResults(),
                false
        );
        List<RetrievedDocument> documents = retriever.retrieve(query);
        ctx.setDocuments(documents != null ? documents : List.of());
        log.info("[Suggestion] [{}] Retrieved {} verified documents", ctx.getSuggestionId(), ctx.getDocuments().size());
        ctx.transition(PipelineState.RETRIEVED);
    }

    private void checkSources(SuggestionPipelineContext ctx) {
        int count = ctx.getDocuments().size();
        if (policy.hasEnoughSources(count)) {
            ctx.transition(PipelineState.SOURCES_CONFIRMED);
        } else {
            log.warn("[Suggestion] [{}] Source guardrail tripped: {} documents, minimum {}",
                    ctx.getSuggestionId(), count, policy.getMinSources());
            ctx.fallback(FallbackReason.INSUFFICIENT_SOURCES);
        }
    }

    private void synthesize(SuggestionPipelineContext ctx) {
        SynthesizedSuggestion synthesized = synthesizer.synthesize(ctx.getDocuments(), ctx.getRouted());
        ctx.setSynthesized(synthesized);
        if (!synthesized.warnings().isEmpty()) {
            log.info("[Suggestion] [{}] Synthesis warnings: {}", ctx.getSuggestionId(), synthesized.warnings());
        }
        ctx.transition(PipelineState.SYNTHESIZED);
    }

    private void checkConfidence(SuggestionPipelineContext ctx) {
        double confidence = ctx.getSynthesized().confidence();
        if (policy.meetsConfidenceFloor(confidence)) {
            ctx.transition(PipelineState.CONFIDENCE_CONFIRMED);
        } else {
            log.warn("[Suggestion] [{}] Confidence guardrail tripped: {} < {}",
                    ctx.getSuggestionId(), confidence, policy.getMinConfidence());
            ctx.fallback(FallbackReason.LOW_CONFIDENCE);
        }
    }

    private void checkSafety(SuggestionPipelineContext ctx) {
        RoutedRequest routed = ctx.getRouted();
        SafetyContext safetyContext = new SafetyContext(
                routed.jurisdictions(),
                routed.standards().isEmpty() ? "general" : routed.standards().get(0),
                true
        );
        SafetyVerdict verdict = safetyValidator.validate(
                ctx.getSynthesized().content().toPlainText(), safetyContext);
        ctx.setSafetyVerdict(verdict);

        if (policy.meetsSafetyFloor(verdict.safe(), verdict.confidence())) {
            ctx.transition(PipelineState.SAFETY_CONFIRMED);
        } else {
            log.warn("[Suggestion] [{}] Safety guardrail tripped: safe={}, confidence={}, issues={}",
                    ctx.getSuggestionId(), verdict.safe(), verdict.confidence(), verdict.issues().size());
            ctx.fallback(FallbackReason.SAFETY_VALIDATION_FAILED);
        }
    }

    // ===== Terminal handling =====

    private SuggestionResponse finish(SuggestionPipelineContext ctx) {
        if (ctx.getState() == PipelineState.SUCCESS) {
            try {
                SuggestionResponse response = successResponse(ctx);
                auditSink.append(auditRecord(ctx, response));
                log.info("[Suggestion] [{}] Completed: confidence={}, humanReview={}, {}ms",
                        ctx.getSuggestionId(), response.confidence(), response.requiresHumanReview(),
                        response.metadata().processingTimeMs());
                return response;
            } catch (RuntimeException e) {
                log.error("[Suggestion] [{}] Could not complete successful suggestion", ctx.getSuggestionId(), e);
                ctx.fail(e);
            }
        }

        SuggestionResponse response = fallbackResponse(ctx);
        try {
            auditSink.append(auditRecord(ctx, response));
        } catch (RuntimeException e) {
            log.error("[Suggestion] [{}] Audit write failed for fallback", ctx.getSuggestionId(), e);
            throw new SuggestionAuditException(ctx.getSuggestionId(), e);
        }
        log.info("[Suggestion] [{}] Fallback: reason={}, {}ms",
                ctx.getSuggestionId(), ctx.getFallbackReason().getCode(), response.metadata().processingTimeMs());
        return response;
    }

    private SuggestionResponse successResponse(SuggestionPipelineContext ctx) {
        SynthesizedSuggestion synthesized = ctx.getSynthesized();
        List<SourceReference> references = ctx.getDocuments().stream()
                .map(RetrievedDocument::toSourceReference)
                .toList();
        return SuggestionResponse.success(
                ctx.getSuggestionId(),
                synthesized.content(),
                references,
                synthesized.confidence(),
                policy.requiresHumanReview(synthesized.confidence()),
                metadata(ctx)
        );
    }

    private SuggestionResponse fallbackResponse(SuggestionPipelineContext ctx) {
        FallbackResponse fallback = fallbackHandler.generateFallback(ctx.getRouted(), ctx.getFallbackReason());
        return SuggestionResponse.fallback(ctx.getSuggestionId(), fallback.message(), metadata(ctx));
    }

    private ResponseMetadata metadata(SuggestionPipelineContext ctx) {
        return new ResponseMetadata(
                Instant.now(),
                ctx.elapsedMs(),
                ctx.getDocuments().size(),
                ctx.getRouted().jurisdictions()
        );
    }

    private SuggestionLog auditRecord(SuggestionPipelineContext ctx, SuggestionResponse response) {
        RoutedRequest routed = ctx.getRouted();
        SuggestionStatus status = status(ctx);
        return SuggestionLog.builder()
                .id(ctx.getSuggestionId())
                .userId(ctx.getUser().id())
                .organizationId(ctx.getUser().organizationId())
                .intent(routed.intent())
                .jurisdictions(routed.jurisdictions())
                .prompt(ctx.getRequest())
                .response(response)
                .sourceReferences(response.sourceReferences())
                .status(status)
                .fallbackReason(ctx.getFallbackReason())
                .errorMessage(ctx.getError() != null ? describe(ctx.getError()) : null)
                .confidence(ctx.getSynthesized() != null ? ctx.getSynthesized().confidence() : null)
                .regulatoryContext(new RegulatoryContext(routed.jurisdictions(), routed.standards()))
                .verificationStatus(status == SuggestionStatus.SUCCESS
                        ? VerificationStatus.VERIFIED : VerificationStatus.PENDING)
                .build();
    }

    private static SuggestionStatus status(SuggestionPipelineContext ctx) {
        if (ctx.getState() == PipelineState.SUCCESS && ctx.getError() == null) {
            return SuggestionStatus.SUCCESS;
        }
        return ctx.getError() != null ? SuggestionStatus.ERROR : SuggestionStatus.FALLBACK;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void emitTransparencyEvent(SuggestionPipelineContext ctx, SuggestionResponse response) {
        SuggestionStatus status = status(ctx);
        try {
            transparencyLogger.logDecision(new TransparencyEvent(
                    ctx.getSuggestionId(),
                    "policy_suggestion_" + ctx.getRouted().intent().getValue(),
                    TransparencyEvent.AI_SYSTEM_ID,
                    ctx.getUser().id(),
                    ctx.getUser().organizationId(),
                    ctx.getRouted().intent(),
                    ctx.getRouted().jurisdictions(),
                    status,
                    ctx.getFallbackReason(),
                    response.confidence(),
                    response.sourceReferences(),
                    status == SuggestionStatus.SUCCESS ? List.of() : List.of(status.name()),
                    response.metadata().processingTimeMs()
            ));
        } catch (RuntimeException e) {
            log.warn("[Suggestion] [{}] Transparency logging failed: {}", ctx.getSuggestionId(), e.getMessage());
        }
    }
}
