package com.policyai.infrastructure.ai.synthesis;

import com.policyai.domain.suggestion.model.MappingTable;
import com.policyai.domain.suggestion.model.OutputFormat;
import com.policyai.domain.suggestion.model.RetrievedDocument;
import com.policyai.domain.suggestion.model.RoutedRequest;
import com.policyai.domain.suggestion.model.SourceType;
import com.policyai.domain.suggestion.model.SynthesisMethod;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps retrieved compliance standards to their itemized clauses and reports coverage of the requested codes.
 */
@Component
@RequiredArgsConstructor
public class MappingTableStrategy implements SynthesisStrategy {

    static final int MAX_CLAUSES_PER_STANDARD = 5;

    private final SectionExtractor extractor;

    @Override
    public OutputFormat format() {
        return OutputFormat.MAPPING_TABLE;
    }

    @Override
    public SynthesisDraft synthesize(List<RetrievedDocument> ranked, RoutedRequest request, List<String> keywords) {
        List<RetrievedDocument> standards = ranked.stream()
                .filter(doc -> doc.sourceType() == SourceType.COMPLIANCE_STANDARD)
                .toList();

        List<MappingTable.MappingRow> rows = standards.stream()
                .map(doc -> new MappingTable.MappingRow(
                        doc.standardCodes().isEmpty() ? doc.id() : doc.standardCodes().get(0),
                        doc.title(),
                        doc.id(),
                        extractor.listItems(doc.content(), MAX_CLAUSES_PER_STANDARD),
                        doc.relevanceScore()))
                .toList();

        Set<String> retrievedCodes = standards.stream()
                .flatMap(doc -> doc.standardCodes().stream())
                .map(code -> code.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());

        List<String> requested = request.standards();
        List<String> gaps = requested.stream()
                .filter(code -> !retrievedCodes.contains(code.toUpperCase(Locale.ROOT)))
                .toList();
        double coverage = requested.isEmpty()
                ? 1.0
                : (double) (requested.size() - gaps.size()) / requested.size();

        List<String> warnings = rows.isEmpty()
                ? List.of("No compliance standards were retrieved for this mapping")
                : List.of();

        return new SynthesisDraft(
                new MappingTable(rows, coverage, gaps),
                standards.stream().map(RetrievedDocument::id).toList(),
                rows.size() > 1 ? SynthesisMethod.MULTI_SOURCE_MERGE : SynthesisMethod.SINGLE_SOURCE,
                warnings
        );
    }
}
