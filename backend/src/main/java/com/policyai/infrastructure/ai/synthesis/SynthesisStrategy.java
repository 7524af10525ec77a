package com.policyai.infrastructure.ai.synthesis;

import com.policyai.domain.suggestion.model.OutputFormat;
import com.policyai.domain.suggestion.model.RetrievedDocument;
import com.policyai.domain.suggestion.model.RoutedRequest;

import java.util.List;

/**
 * Assembles one output format from retrieved documents.
 */
public interface SynthesisStrategy {

    OutputFormat format();

    /**
     * @param ranked   documents sorted by {@link RetrievedDocument#BY_RELEVANCE}
     * @param request  the routed request
     * @param keywords keywords extracted from the request context
     */
    SynthesisDraft synthesize(List<RetrievedDocument> ranked, RoutedRequest request, List<String> keywords);
}
