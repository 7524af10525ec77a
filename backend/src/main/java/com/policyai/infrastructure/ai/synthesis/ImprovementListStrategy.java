package com.policyai.infrastructure.ai.synthesis;

import com.policyai.domain.suggestion.model.ImprovementList;
import com.policyai.domain.suggestion.model.OutputFormat;
import com.policyai.domain.suggestion.model.RelevanceBand;
import com.policyai.domain.suggestion.model.RetrievedDocument;
import com.policyai.domain.suggestion.model.RoutedRequest;
import com.policyai.domain.suggestion.model.SynthesisMethod;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.IntStream;

@Component
@RequiredArgsConstructor
public class ImprovementListStrategy implements SynthesisStrategy {

    static final int MAX_IMPROVEMENTS = 5;

    private final SectionExtractor extractor;

    @Override
    public OutputFormat format() {
        return OutputFormat.IMPROVEMENT_LIST;
    }

    @Override
    public SynthesisDraft synthesize(List<RetrievedDocument> ranked, RoutedRequest request, List<String> keywords) {
        List<RetrievedDocument> top = ranked.stream().limit(MAX_IMPROVEMENTS).toList();

        List<ImprovementList.Improvement> improvements = IntStream.range(0, top.size())
                .mapToObj(i -> {
                    RetrievedDocument doc = top.get(i);
                    return new ImprovementList.Improvement(
                            i + 1,
                            doc.id(),
                            doc.title(),
                            extractor.anchoredText(doc.content(), keywords),
                            RelevanceBand.of(doc.relevanceScore()));
                })
                .toList();

        return new SynthesisDraft(
                new ImprovementList(improvements),
                top.stream().map(RetrievedDocument::id).toList(),
                top.size() > 1 ? SynthesisMethod.MULTI_SOURCE_MERGE : SynthesisMethod.SINGLE_SOURCE,
                List.of()
        );
    }
}
