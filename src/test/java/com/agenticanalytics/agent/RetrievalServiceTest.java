package com.agenticanalytics.agent;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.agenticanalytics.cache.SemanticCache;
import com.agenticanalytics.observability.LatencyTracker;
import com.agenticanalytics.observability.OperationType;
import com.agenticanalytics.retrieval.ChunkMetadata;
import com.agenticanalytics.retrieval.ChunkType;
import com.agenticanalytics.retrieval.DocumentInput;
import com.agenticanalytics.retrieval.LazyEmbeddingService;
import com.agenticanalytics.retrieval.LocalJsonVectorIndex;
import com.agenticanalytics.retrieval.Reranker;
import com.agenticanalytics.retrieval.SearchResult;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

class RetrievalServiceTest {
    private final LazyEmbeddingService embeddings = LazyEmbeddingService.fallbackOnly(128);
    private final LatencyTracker tracker = new LatencyTracker();
    private LocalJsonVectorIndex index;

    @BeforeEach
    void setUp() {
        index = new LocalJsonVectorIndex(embeddings, "auto", tracker);
        index.addDocuments(List.of(
                new DocumentInput("orders", "Table orders: one row per order", ChunkMetadata.ofType(ChunkType.TABLE)),
                new DocumentInput("amount", "Column orders.amount in USD", ChunkMetadata.ofType(ChunkType.COLUMN)),
                new DocumentInput("revenue", "total revenue by region", ChunkMetadata.ofType(ChunkType.METRIC)),
                new DocumentInput("customers", "orders joins customers on customer_id",
                        ChunkMetadata.ofType(ChunkType.RELATIONSHIP))));
    }

    @Test
    void shouldRetrieveRerankedContextLimitedToTopK() {
        RetrievalService service = new RetrievalService(index, new Reranker(), null, tracker);

        List<SearchResult> context = service.retrieve("total revenue by region", 2, null, "trace-r");

        assertEquals(2, context.size());
        assertEquals("revenue", context.get(0).documentId());
        assertTrue(context.get(0).metadata().attributes().containsKey(Reranker.ORIGINAL_RANK));
        List<SearchResult> metrics = service.retrieve("revenue", 1, Map.of(ChunkMetadata.CHUNK_TYPE, "metric"), null);
        assertEquals("metric", metrics.get(0).chunkTypeValue());
    }

    @Test
    void shouldReturnWholeCorpusWhenTopKIsUnbounded() {
        RetrievalService service = new RetrievalService(index, new Reranker(), null, tracker);

        List<SearchResult> context = service.retrieve("orders", Integer.MAX_VALUE, null, null);

        assertEquals(4, context.size());
        for (int i = 1; i < context.size(); i++) {
            assertTrue(context.get(i - 1).score() >= context.get(i).score());
        }
        assertEquals(1, service.retrieve("orders", Integer.MAX_VALUE,
                Map.of(ChunkMetadata.CHUNK_TYPE, "metric"), null).size());
    }

    @Test
    void shouldServeRepeatQuestionFromCacheWithoutRegenerating() throws Exception {
        SemanticCache cache = new SemanticCache(embeddings, null);
        RetrievalService service = new RetrievalService(index, new Reranker(), cache, tracker);
        List<String> prompts = new ArrayList<>();
        AnswerGenerator generator = (question, context) -> {
            prompts.add(question);
            return new GeneratedAnswer("SELECT region, SUM(amount) FROM orders GROUP BY region",
                    JsonNodeFactory.instance.objectNode().put("EMEA", 1200), "EMEA leads");
        };

        RetrievalOutcome first = service.answer("total revenue by region", 3, null, "trace-1", generator);
        RetrievalOutcome second = service.answer("total revenue by region", 3, null, "trace-2", generator);

        assertFalse(first.cached());
        assertEquals(3, first.context().size());
        assertTrue(second.cached());
        assertTrue(second.similarity() >= 0.95f);
        assertEquals("EMEA leads", second.answer().answer());
        assertEquals(1200, second.answer().resultPayload().get("EMEA").asInt());
        assertEquals(List.of("total revenue by region"), prompts);
        assertEquals(2, tracker.stats(OperationType.TOTAL_REQUEST).orElseThrow().count());
    }

    @Test
    void shouldNotCacheAnswersMarkedUncacheable() throws Exception {
        SemanticCache cache = new SemanticCache(embeddings, null);
        RetrievalService service = new RetrievalService(index, new Reranker(), cache, tracker);
        AnswerGenerator failing = (question, context) -> new GeneratedAnswer(null, null, "query failed", false);

        service.answer("orders per customer", 2, null, null, failing);

        assertEquals(0, cache.size());
        assertFalse(service.answer("orders per customer", 2, null, null, failing).cached());
    }

    @Test
    void shouldGenerateEveryTimeWhenCacheDisabled() throws Exception {
        RetrievalService service = new RetrievalService(index, new Reranker(), null, null);
        int[] calls = { 0 };
        AnswerGenerator generator = (question, context) -> {
            calls[0]++;
            return new GeneratedAnswer("q", null, "a");
        };

        service.answer("orders", 1, null, null, generator);
        service.answer("orders", 1, null, null, generator);

        assertEquals(2, calls[0]);
    }
}
