package com.policyai.infrastructure.ai.pipeline;

import com.policyai.domain.suggestion.exception.SuggestionValidationException;
import com.policyai.domain.suggestion.model.Jurisdiction;
import com.policyai.domain.suggestion.model.OutputFormat;
import com.policyai.domain.suggestion.model.RoutedRequest;
import com.policyai.domain.suggestion.model.SuggestionIntent;
import com.policyai.domain.suggestion.model.SuggestionRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.policyai.infrastructure.ai.pipeline.RequiredField.*;

/**
 * Validates an authoring request and binds it to exactly one output format.
 * <p>
 * Routing is driven by {@link #ROUTES}; every {@link SuggestionIntent} has exactly one entry.
 * </p>
 */
@Slf4j
@Component
public class PromptOrchestrator {

    static final Map<SuggestionIntent, IntentRoute> ROUTES;

    static {
        Map<SuggestionIntent, IntentRoute> routes = new EnumMap<>(SuggestionIntent.class);
        routes.put(SuggestionIntent.SUGGEST_CLAUSE,
                new IntentRoute(OutputFormat.STRUCTURED_CLAUSE, Set.of(TEMPLATE_REFERENCE)));
        routes.put(SuggestionIntent.MAP_POLICY,
                new IntentRoute(OutputFormat.MAPPING_TABLE, Set.of(POLICY_REFERENCE, STANDARDS)));
        routes.put(SuggestionIntent.REVIEW_POLICY,
                new IntentRoute(OutputFormat.REVIEW_REPORT, Set.of(POLICY_REFERENCE)));
        routes.put(SuggestionIntent.SUGGEST_IMPROVEMENT,
                new IntentRoute(OutputFormat.IMPROVEMENT_LIST, Set.of()));
        routes.put(SuggestionIntent.VALIDATE_COMPLIANCE,
                new IntentRoute(OutputFormat.MAPPING_TABLE, Set.of(STANDARDS)));
        ROUTES = Collections.unmodifiableMap(routes);
    }

    public RoutedRequest route(SuggestionRequest request) {
        if (request == null) {
            throw new SuggestionValidationException("Request is required.");
        }
        if (request.intent() == null || request.intent().isBlank()) {
            throw new SuggestionValidationException("Intent is required.");
        }

        List<Jurisdiction> jurisdictions = parseJurisdictions(request.jurisdictions());

        if (request.context() == null || request.context().isBlank()) {
            throw new SuggestionValidationException("Context is required.");
        }

        SuggestionIntent intent = SuggestionIntent.fromValue(request.intent())
                .orElseThrow(() -> new SuggestionValidationException(
                        "Unsupported intent: " + request.intent()));
        IntentRoute route = ROUTES.get(intent);

        List<String> missing = route.requiredFields().stream()
                .filter(field -> !field.isPresentIn(request))
                .sorted()
                .map(RequiredField::getDescription)
                .toList();
        if (!missing.isEmpty()) {
            throw new SuggestionValidationException(
                    "Intent " + intent.getValue() + " requires " + String.join(" and ", missing) + ".");
        }

        RoutedRequest routed = new RoutedRequest(
                intent,
                route.outputFormat(),
                request.templateId(),
                request.policyId(),
                jurisdictions,
                request.context(),
                cleanStandards(request.standards())
        );
        log.debug("[Router] intent={} → format={}, jurisdictions={}",
                intent.getValue(), route.outputFormat(), jurisdictions);
        return routed;
    }

    private List<Jurisdiction> parseJurisdictions(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new SuggestionValidationException("At least one jurisdiction is required.");
        }

        List<Jurisdiction> parsed = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String value : raw) {
            Optional<Jurisdiction> jurisdiction = Jurisdiction.parse(value);
            if (jurisdiction.isPresent()) {
                if (!parsed.contains(jurisdiction.get())) {
                    parsed.add(jurisdiction.get());
                }
            } else {
                invalid.add(String.valueOf(value));
            }
        }

        if (!invalid.isEmpty()) {
            throw new SuggestionValidationException("Invalid jurisdictions: " + String.join(", ", invalid));
        }
        return parsed;
    }

    private static List<String> cleanStandards(List<String> standards) {
        if (standards == null) {
            return List.of();
        }
        return standards.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
    }
}
