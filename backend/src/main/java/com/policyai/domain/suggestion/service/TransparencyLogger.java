package com.policyai.domain.suggestion.service;

import com.policyai.domain.suggestion.model.TransparencyEvent;

/**
 * Decision-explainability log. Fire-and-forget: callers must not depend on it succeeding.
 */
public interface TransparencyLogger {

    void logDecision(TransparencyEvent event);
}
