package com.agenticanalytics.agent;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agenticanalytics.cache.CacheEntry;
import com.agenticanalytics.cache.CacheHit;
import com.agenticanalytics.cache.SemanticCache;
import com.agenticanalytics.observability.OperationType;
import com.agenticanalytics.observability.TelemetryEmitter;
import com.agenticanalytics.observability.TelemetrySink;
import com.agenticanalytics.retrieval.Reranker;
import com.agenticanalytics.retrieval.SearchResult;
import com.agenticanalytics.retrieval.VectorIndex;

public class RetrievalService {
    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);
    private static final int CANDIDATE_FACTOR = 3;

    private final VectorIndex index;
    private final Reranker reranker;
    private final SemanticCache cache;
    private final TelemetryEmitter telemetry;

    public RetrievalService(VectorIndex index, Reranker reranker, SemanticCache cache, TelemetrySink telemetrySink) {
        this.index = index;
        this.reranker = reranker;
        this.cache = cache;
        this.telemetry = new TelemetryEmitter(telemetrySink);
    }

    public List<SearchResult> retrieve(String query, int topK, Map<String, ?> filter, String traceId) {
        int candidates = (int) Math.min(Integer.MAX_VALUE, (long) topK * CANDIDATE_FACTOR);
        return reranker.rerank(index.search(query, candidates, filter, traceId), query, topK, null);
    }

    public RetrievalOutcome answer(String question, int topK, Map<String, ?> filter, String traceId,
            AnswerGenerator generator) throws IOException {
        long start = System.nanoTime();
        if (cache != null) {
            Optional<CacheHit> hit = cache.lookup(question, traceId);
            if (hit.isPresent()) {
                CacheEntry entry = hit.get().entry();
                telemetry.emit(OperationType.TOTAL_REQUEST, start, traceId, Map.of("cached", true));
                return RetrievalOutcome.cached(question,
                        new GeneratedAnswer(entry.generatedQuery(), entry.resultPayload(), entry.answer()),
                        hit.get().similarity());
            }
        }

        List<SearchResult> context = retrieve(question, topK, filter, traceId);
        log.debug("Retrieved {} context results for traceId={}", context.size(), traceId);
        GeneratedAnswer generated = generator.generate(question, context);
        if (cache != null && generated != null && generated.cacheable()) {
            cache.store(question, generated.generatedQuery(), generated.resultPayload(), generated.answer(), traceId);
        }
        telemetry.emit(OperationType.TOTAL_REQUEST, start, traceId, Map.of("cached", false));
        return RetrievalOutcome.fresh(question, generated, context);
    }
}
