package com.policyai.infrastructure.ai.pipeline;

/**
 * States of one suggestion run. Guardrail failures and unexpected errors all lead to {@link #FALLBACK}.
 */
public enum PipelineState {
    START,
    AUTHORIZED,
    ROUTED,
    RETRIEVED,
    SOURCES_CONFIRMED,
    SYNTHESIZED,
    CONFIDENCE_CONFIRMED,
    SAFETY_CONFIRMED,
    SUCCESS,
    FALLBACK;

    public boolean isTerminal() {
        return this == SUCCESS || this == FALLBACK;
    }
}
