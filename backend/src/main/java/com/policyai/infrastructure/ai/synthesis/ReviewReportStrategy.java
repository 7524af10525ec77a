package com.policyai.infrastructure.ai.synthesis;

import com.policyai.domain.suggestion.model.OutputFormat;
import com.policyai.domain.suggestion.model.RelevanceBand;
import com.policyai.domain.suggestion.model.RetrievedDocument;
import com.policyai.domain.suggestion.model.ReviewReport;
import com.policyai.domain.suggestion.model.RoutedRequest;
import com.policyai.domain.suggestion.model.SourceType;
import com.policyai.domain.suggestion.model.SynthesisMethod;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.IntStream;

@Component
@RequiredArgsConstructor
public class ReviewReportStrategy implements SynthesisStrategy {

    static final int MAX_RECOMMENDATIONS = 3;

    private final SectionExtractor extractor;

    @Override
    public OutputFormat format() {
        return OutputFormat.REVIEW_REPORT;
    }

    @Override
    public SynthesisDraft synthesize(List<RetrievedDocument> ranked, RoutedRequest request, List<String> keywords) {
        List<ReviewReport.Finding> findings = ranked.stream()
                .map(doc -> new ReviewReport.Finding(
                        doc.id(),
                        doc.title(),
                        RelevanceBand.of(doc.relevanceScore()),
                        extractor.excerpt(doc.content(), keywords),
                        doc.relevanceScore()))
                .toList();

        List<ReviewReport.Recommendation> recommendations = IntStream.range(0, Math.min(MAX_RECOMMENDATIONS, ranked.size()))
                .mapToObj(i -> {
                    RetrievedDocument doc = ranked.get(i);
                    return new ReviewReport.Recommendation(
                            i + 1, doc.id(), doc.title(), extractor.anchoredText(doc.content(), keywords));
                })
                .toList();

        long standardCount = ranked.stream()
                .filter(doc -> doc.sourceType() == SourceType.COMPLIANCE_STANDARD)
                .count();
        ReviewReport.ComplianceStatus status = standardCount >= request.standards().size()
                ? ReviewReport.ComplianceStatus.COMPLIANT
                : ReviewReport.ComplianceStatus.PARTIAL;

        return new SynthesisDraft(
                new ReviewReport(findings, recommendations, status),
                ranked.stream().map(RetrievedDocument::id).toList(),
                ranked.size() > 1 ? SynthesisMethod.MULTI_SOURCE_MERGE : SynthesisMethod.SINGLE_SOURCE,
                List.of()
        );
    }
}
