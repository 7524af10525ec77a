package com.policyai.domain.suggestion.model;

import java.util.List;

/**
 * Raw authoring request as submitted by the caller. Values are kept as strings so that
 * unknown intents and jurisdictions can be reported back by name during routing.
 *
 * @param intent        one of the {@link SuggestionIntent} wire values
 * @param templateId    template reference, required for suggest-clause
 * @param policyId      policy reference, required for map-policy and review-policy
 * @param jurisdictions non-empty list of jurisdiction names
 * @param context       free-text description of what the author needs
 * @param standards     target standard codes, required for map-policy and validate-compliance
 * @param userRole      role of the requesting user as declared by the caller
 * @param userId        id of the requesting user
 */
public record SuggestionRequest(
        String intent,
        String templateId,
        String policyId,
        List<String> jurisdictions,
        String context,
        List<String> standards,
        String userRole,
        String userId
) {}
