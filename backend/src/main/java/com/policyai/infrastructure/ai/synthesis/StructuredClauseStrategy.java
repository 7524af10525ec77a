package com.policyai.infrastructure.ai.synthesis;

import com.policyai.domain.suggestion.model.OutputFormat;
import com.policyai.domain.suggestion.model.RetrievedDocument;
import com.policyai.domain.suggestion.model.RoutedRequest;
import com.policyai.domain.suggestion.model.SourceType;
import com.policyai.domain.suggestion.model.StructuredClause;
import com.policyai.domain.suggestion.model.SynthesisMethod;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Lifts a clause from the highest-relevance document; the next two documents become supporting references.
 */
@Component
@RequiredArgsConstructor
public class StructuredClauseStrategy implements SynthesisStrategy {

    static final int MAX_SUPPORTING = 2;

    private final SectionExtractor extractor;

    @Override
    public OutputFormat format() {
        return OutputFormat.STRUCTURED_CLAUSE;
    }

    @Override
    public SynthesisDraft synthesize(List<RetrievedDocument> ranked, RoutedRequest request, List<String> keywords) {
        if (ranked.isEmpty()) {
            StructuredClause empty = new StructuredClause("", "", "", null, List.of());
            return new SynthesisDraft(empty, List.of(), SynthesisMethod.SINGLE_SOURCE,
                    List.of("No source documents were available to assemble a clause"));
        }

        RetrievedDocument primary = ranked.get(0);
        List<StructuredClause.SupportingReference> supporting = ranked.stream()
                .skip(1)
                .limit(MAX_SUPPORTING)
                .map(doc -> new StructuredClause.SupportingReference(
                        doc.id(), doc.title(), extractor.excerpt(doc.content(), keywords), doc.relevanceScore()))
                .toList();

        String rationale = extractor.rationale(primary.content())
                .orElse("Derived from " + primary.title() + " v" + primary.version());

        StructuredClause clause = new StructuredClause(
                primary.title(),
                extractor.anchoredText(primary.content(), keywords),
                rationale,
                primary.id(),
                supporting
        );

        List<String> sourceIds = new ArrayList<>();
        sourceIds.add(primary.id());
        supporting.forEach(ref -> sourceIds.add(ref.sourceId()));

        return new SynthesisDraft(clause, sourceIds, methodFor(primary, supporting), List.of());
    }

    private static SynthesisMethod methodFor(RetrievedDocument primary,
                                             List<StructuredClause.SupportingReference> supporting) {
        if (primary.sourceType() == SourceType.POLICY_TEMPLATE) {
            return SynthesisMethod.TEMPLATE_ASSEMBLY;
        }
        return supporting.isEmpty() ? SynthesisMethod.SINGLE_SOURCE : SynthesisMethod.MULTI_SOURCE_MERGE;
    }
}
