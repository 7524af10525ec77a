package com.policyai.domain.suggestion.service;

import com.policyai.domain.suggestion.model.SafetyContext;
import com.policyai.domain.suggestion.model.SafetyVerdict;

/**
 * External content-safety check applied to every assembled suggestion before it is returned.
 */
public interface ContentSafetyValidator {

    SafetyVerdict validate(String content, SafetyContext context);
}
