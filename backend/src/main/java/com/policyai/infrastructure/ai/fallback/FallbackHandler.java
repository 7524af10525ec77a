package com.policyai.infrastructure.ai.fallback;

import com.policyai.domain.suggestion.model.FallbackReason;
import com.policyai.domain.suggestion.model.FallbackResponse;
import com.policyai.domain.suggestion.model.Jurisdiction;
import com.policyai.domain.suggestion.model.RoutedRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the fixed, non-authoritative answer for each fallback reason. Never includes policy content.
 */
@Slf4j
@Component
public class FallbackHandler {

    public FallbackResponse generateFallback(RoutedRequest request, FallbackReason reason) {
        String scope = describeScope(request);
        FallbackResponse response = switch (reason) {
            case INSUFFICIENT_SOURCES -> new FallbackResponse(
                    reason,
                    "Not enough verified source material was found" + scope
                            + " to suggest content safely. Please involve your compliance officer.",
                    List.of(
                            "Consult the policy template library directly",
                            "Add more detail to the request or widen the jurisdictions",
                            "Draft the section manually and have it reviewed by your compliance officer"
                    ),
                    true,
                    false);
            case LOW_CONFIDENCE -> new FallbackResponse(
                    reason,
                    "Matching source material was found" + scope
                            + " but it is not a close enough fit to suggest with confidence.",
                    List.of(
                            "Review the partially matching templates and standards manually",
                            "Refine the request with more specific context or target standards"
                    ),
                    true,
                    false);
            case SAFETY_VALIDATION_FAILED -> new FallbackResponse(
                    reason,
                    "The assembled suggestion did not pass content-safety checks and has been withheld.",
                    List.of(
                            "Contact your compliance officer before drafting this section",
                            "Check that the source templates contain no personal data or unresolved placeholders"
                    ),
                    true,
                    true);
            case SYSTEM_ERROR -> new FallbackResponse(
                    reason,
                    "Suggestions are temporarily unavailable. Please try again later.",
                    List.of(
                            "Retry the request in a few minutes",
                            "Contact support if the problem persists"
                    ),
                    false,
                    false);
        };
        log.debug("[Fallback] reason={}, escalation={}", reason.getCode(), response.escalationRequired());
        return response;
    }

    private static String describeScope(RoutedRequest request) {
        if (request == null || request.jurisdictions().isEmpty()) {
            return "";
        }
        return " for " + request.jurisdictions().stream()
                .map(Jurisdiction::getDisplayName)
                .collect(Collectors.joining(", "));
    }
}
