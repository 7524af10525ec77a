package com.policyai.infrastructure.ai.synthesis;

import com.policyai.domain.suggestion.model.OutputFormat;
import com.policyai.domain.suggestion.model.RetrievedDocument;
import com.policyai.domain.suggestion.model.RoutedRequest;
import com.policyai.domain.suggestion.model.SynthesizedSuggestion;
import com.policyai.infrastructure.ai.retrieval.KeywordExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles a suggestion from retrieved text by dispatching on the routed output format,
 * then scores it with {@link ConfidenceCalculator}.
 */
@Slf4j
@Component
public class ClauseSynthesizer {

    private final Map<OutputFormat, SynthesisStrategy> strategies;
    private final ConfidenceCalculator confidenceCalculator;
    private final KeywordExtractor keywordExtractor;

    public ClauseSynthesizer(List<SynthesisStrategy> strategies,
                             ConfidenceCalculator confidenceCalculator,
                             KeywordExtractor keywordExtractor) {
        Map<OutputFormat, SynthesisStrategy> byFormat = new EnumMap<>(OutputFormat.class);
        for (SynthesisStrategy strategy : strategies) {
            SynthesisStrategy previous = byFormat.put(strategy.format(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate synthesis strategy for " + strategy.format());
            }
        }
        for (OutputFormat format : OutputFormat.values()) {
            if (!byFormat.containsKey(format)) {
                throw new IllegalStateException("No synthesis strategy registered for " + format);
            }
        }
        this.strategies = Collections.unmodifiableMap(byFormat);
        this.confidenceCalculator = confidenceCalculator;
        this.keywordExtractor = keywordExtractor;
    }

    public SynthesizedSuggestion synthesize(List<RetrievedDocument> documents, RoutedRequest request) {
        List<RetrievedDocument> ranked = documents.stream()
                .sorted(RetrievedDocument.BY_RELEVANCE)
                .toList();
        List<String> keywords = keywordExtractor.extract(request.context());

        SynthesisDraft draft = strategies.get(request.outputFormat()).synthesize(ranked, request, keywords);

        double confidence = confidenceCalculator.calculate(ranked);
        List<String> warnings = new ArrayList<>(confidenceCalculator.warnings(ranked, confidence));
        warnings.addAll(draft.warnings());

        log.debug("[Synthesis] format={}, method={}, sources={}, confidence={}",
                request.outputFormat(), draft.method(), draft.sourceIds().size(), confidence);

        return new SynthesizedSuggestion(
                draft.content(),
                confidence,
                draft.sourceIds(),
                draft.method(),
                List.copyOf(warnings)
        );
    }
}
