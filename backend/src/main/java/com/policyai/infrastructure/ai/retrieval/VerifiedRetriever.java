package com.policyai.infrastructure.ai.retrieval;

import com.policyai.domain.knowledge.model.KnowledgeDocument;
import com.policyai.domain.knowledge.model.KnowledgeFilter;
import com.policyai.domain.knowledge.service.KnowledgeStore;
import com.policyai.domain.suggestion.model.RetrievalQuery;
import com.policyai.domain.suggestion.model.RetrievedDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Retrieves scored documents from the three verified knowledge collections.
 * <p>
 * Templates, standards and jurisdictional rules are queried in parallel and joined under a
 * single deadline. A failure or timeout of any one collection fails the whole retrieval and
 * interrupts the queries still in flight.
 * Merged results are filtered by minimum relevance, sorted by descending relevance
 * (ties broken by collection order, then id) and truncated to the requested maximum.
 * </p>
 */
@Slf4j
@Component
public class VerifiedRetriever {

    private final KnowledgeStore knowledgeStore;
    private final RelevanceScorer relevanceScorer;
    private final Executor retrievalExecutor;
    private final long timeoutMs;

    public VerifiedRetriever(KnowledgeStore knowledgeStore,
                             RelevanceScorer relevanceScorer,
                             @Qualifier("retrievalExecutor") Executor retrievalExecutor,
                             @Value("${suggestion.retrieval.timeout-ms:5000}") long timeoutMs) {
        this.knowledgeStore = knowledgeStore;
        this.relevanceScorer = relevanceScorer;
        this.retrievalExecutor = retrievalExecutor;
        this.timeoutMs = timeoutMs;
    }

    public List<RetrievedDocument> retrieve(RetrievalQuery query) {
        KnowledgeFilter filter = new KnowledgeFilter(
                query.keywords(), query.jurisdictions(), query.standards(), query.includeDeprecated());

        FutureTask<List<KnowledgeDocument>> templates =
                submit("policy templates", () -> knowledgeStore.queryTemplates(filter));
        FutureTask<List<KnowledgeDocument>> standards =
                submit("compliance standards", () -> knowledgeStore.queryStandards(filter));
        FutureTask<List<KnowledgeDocument>> rules =
                submit("jurisdictional rules", () -> knowledgeStore.queryRules(filter));

        List<KnowledgeDocument> merged = new ArrayList<>();
        awaitAll(List.of(templates, standards, rules)).forEach(merged::addAll);

        List<RetrievedDocument> ranked = merged.stream()
                .map(doc -> score(doc, query))
                .filter(doc -> doc.relevanceScore() >= query.minRelevanceScore())
                .sorted(RetrievedDocument.BY_RELEVANCE)
                .limit(Math.max(0, query.maxResults()))
                .toList();

        log.info("[Retriever] keywords={}, jurisdictions={}, candidates={}, returned={}",
                query.keywords().size(), query.jurisdictions(), merged.size(), ranked.size());
        return ranked;
    }

    private FutureTask<List<KnowledgeDocument>> submit(String collection,
                                                       Supplier<List<KnowledgeDocument>> query) {
        FutureTask<List<KnowledgeDocument>> task = new FutureTask<>(() -> {
            try {
                List<KnowledgeDocument> docs = query.get();
                return docs == null ? List.<KnowledgeDocument>of() : docs;
            } catch (RuntimeException e) {
                throw new KnowledgeRetrievalException("Failed to query " + collection, e);
            }
        });
        retrievalExecutor.execute(task);
        return task;
    }

    /**
     * Waits for every task under one shared deadline. On timeout or failure the remaining
     * tasks are cancelled, which interrupts queries still running on the executor.
     */
    private List<List<KnowledgeDocument>> awaitAll(List<FutureTask<List<KnowledgeDocument>>> tasks) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        List<List<KnowledgeDocument>> results = new ArrayList<>(tasks.size());
        try {
            for (FutureTask<List<KnowledgeDocument>> task : tasks) {
                results.add(task.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS));
            }
            return results;
        } catch (TimeoutException e) {
            cancelAll(tasks);
            throw new KnowledgeRetrievalException("Knowledge retrieval timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            cancelAll(tasks);
            Throwable cause = e.getCause();
            if (cause instanceof KnowledgeRetrievalException kre) throw kre;
            throw new KnowledgeRetrievalException("Knowledge retrieval failed", cause);
        } catch (InterruptedException e) {
            cancelAll(tasks);
            Thread.currentThread().interrupt();
            throw new KnowledgeRetrievalException("Knowledge retrieval interrupted", e);
        }
    }

    private static void cancelAll(List<? extends Future<?>> tasks) {
        for (Future<?> task : tasks) {
            task.cancel(true);
        }
    }

    private RetrievedDocument score(KnowledgeDocument doc, RetrievalQuery query) {
        double relevance = relevanceScorer.score(doc.title(), doc.content(), query.keywords());
        return new RetrievedDocument(
                doc.sourceType(),
                doc.id(),
                doc.title(),
                doc.content(),
                doc.version(),
                doc.section(),
                doc.jurisdictions(),
                doc.standardCodes(),
                relevance,
                doc.verificationStatus(),
                doc.lastUpdated(),
                doc.metadata()
        );
    }
}
