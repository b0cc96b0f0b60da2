package com.agenticanalytics.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.agenticanalytics.observability.LatencyTracker;
import com.agenticanalytics.observability.OperationType;
import com.agenticanalytics.retrieval.EmbeddingService;
import com.agenticanalytics.retrieval.LazyEmbeddingService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

class SemanticCacheTest {
    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");
    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void shouldHitForSameQuestionAndMissForUnrelatedText() throws Exception {
        SemanticCache cache = new SemanticCache(LazyEmbeddingService.fallbackOnly(384), null);
        JsonNode payload = mapper.readTree("[{\"region\":\"EMEA\",\"revenue\":1200.5}]");

        assertEquals(StoreOutcome.STORED, cache.store("total revenue by region",
                "SELECT region, SUM(amount) FROM orders GROUP BY region", payload, "EMEA leads with 1200.5"));

        Optional<CacheHit> hit = cache.lookup("total revenue by region");
        assertTrue(hit.isPresent());
        assertEquals(1.0f, hit.get().similarity(), 1e-5f);
        assertEquals("EMEA leads with 1200.5", hit.get().entry().answer());
        assertEquals(payload, hit.get().entry().resultPayload());
        assertTrue(cache.lookup("completely unrelated text").isEmpty());

        CacheStats stats = cache.stats();
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(0.5d, stats.hitRate(), 1e-9);
    }

    @Test
    void shouldMissOnEmptyCacheWithoutEmbedding() {
        CountingEmbeddings embeddings = new CountingEmbeddings();
        SemanticCache cache = new SemanticCache(embeddings, null);

        assertTrue(cache.lookup("anything").isEmpty());
        assertEquals(0, embeddings.calls);
        assertEquals(1, cache.stats().misses());
    }

    @Test
    void shouldRecordTelemetryForLookupOnEmptyCache() {
        LatencyTracker tracker = new LatencyTracker();
        SemanticCache cache = new SemanticCache(new CountingEmbeddings(), null, CachePolicy.defaults(),
                new MutableClock(START), tracker);

        cache.lookup("anything", "trace-empty");

        assertEquals(1, tracker.stats(OperationType.CACHE_LOOKUP).orElseThrow().count());
        assertEquals(Boolean.FALSE, tracker.recordsForTrace("trace-empty").get(0).metadata().get("hit"));
    }

    @Test
    void shouldNotLetCallersAlterCachedEmbeddings() {
        SemanticCache cache = new SemanticCache(LazyEmbeddingService.fallbackOnly(64), null);
        cache.store("total revenue by region", "q", null, "a");

        CacheHit first = cache.lookup("total revenue by region").orElseThrow();
        Arrays.fill(first.entry().embedding(), 0f);
        Arrays.fill(cache.entries().get(0).embedding(), 0f);

        CacheHit second = cache.lookup("total revenue by region").orElseThrow();
        assertEquals(1.0f, second.similarity(), 1e-5f);
        assertEquals(64, second.entry().embedding().length);
    }

    @Test
    void shouldServeLookupsWhileStoresRunConcurrently() throws Exception {
        SemanticCache cache = new SemanticCache(LazyEmbeddingService.fallbackOnly(64), null,
                new CachePolicy(0.95f, 0, null), new MutableClock(START), null);
        cache.store("total revenue by region", "q", null, "seeded");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch ready = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int writer = 0; writer < 2; writer++) {
                int offset = writer * 25;
                futures.add(executor.submit(() -> {
                    ready.await();
                    for (int i = 0; i < 25; i++) {
                        cache.store("question number " + (offset + i), "q", null, "a" + (offset + i));
                    }
                    return null;
                }));
            }
            for (int reader = 0; reader < 2; reader++) {
                futures.add(executor.submit(() -> {
                    ready.await();
                    for (int i = 0; i < 100; i++) {
                        CacheHit hit = cache.lookup("total revenue by region").orElseThrow();
                        assertEquals("seeded", hit.entry().answer());
                        assertEquals(1.0f, hit.similarity(), 1e-5f);
                    }
                    return null;
                }));
            }
            ready.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(51, cache.size());
        assertEquals(200, cache.stats().hits());
    }

    @Test
    void shouldTreatThresholdAsInclusive() {
        CountingEmbeddings embeddings = new CountingEmbeddings();
        embeddings.vectors.put("stored", new float[] { 1f, 0f });
        embeddings.vectors.put("same direction", new float[] { 3f, 0f });
        embeddings.vectors.put("close", new float[] { 0.81f, (float) Math.sqrt(1 - 0.81 * 0.81) });
        embeddings.vectors.put("far", new float[] { 0.79f, (float) Math.sqrt(1 - 0.79 * 0.79) });

        SemanticCache exact = cache(embeddings, new CachePolicy(1.0f, 10, null), null);
        exact.store("stored", "q", null, "a");
        assertTrue(exact.lookup("same direction").isPresent());

        SemanticCache loose = cache(embeddings, new CachePolicy(0.8f, 10, null), null);
        loose.store("stored", "q", null, "a");
        assertTrue(loose.lookup("close").isPresent());
        assertTrue(loose.lookup("far").isEmpty());
    }

    @Test
    void shouldSkipNearDuplicateStore() {
        SemanticCache cache = new SemanticCache(LazyEmbeddingService.fallbackOnly(64), null);

        cache.store("top customers", "q1", null, "first answer");
        StoreOutcome second = cache.store("top customers", "q2", null, "second answer");

        assertEquals(StoreOutcome.SKIPPED_DUPLICATE, second);
        assertEquals(1, cache.size());
        assertEquals("first answer", cache.lookup("top customers").orElseThrow().entry().answer());
    }

    @Test
    void shouldPersistEntriesAndReloadThem() throws Exception {
        Path file = tempDir.resolve("config/semantic_cache.json");
        SemanticCache cache = new SemanticCache(LazyEmbeddingService.fallbackOnly(64), file);
        cache.store("monthly active users", "SELECT COUNT(DISTINCT user_id) FROM events", mapper.readTree("{\"mau\":42}"),
                "42 monthly active users");

        SemanticCache reloaded = new SemanticCache(LazyEmbeddingService.fallbackOnly(64), file);

        assertEquals(1, reloaded.size());
        CacheHit hit = reloaded.lookup("monthly active users").orElseThrow();
        assertEquals(42, hit.entry().resultPayload().get("mau").asInt());
        assertEquals("SELECT COUNT(DISTINCT user_id) FROM events", hit.entry().generatedQuery());
        assertTrue(Files.readString(file).contains("\"createdAt\""));
    }

    @Test
    void shouldStartEmptyWhenPersistedFileIsCorrupt() throws Exception {
        Path file = tempDir.resolve("semantic_cache.json");
        Files.writeString(file, "[{\"query\": ");

        SemanticCache cache = new SemanticCache(LazyEmbeddingService.fallbackOnly(16), file);

        assertEquals(0, cache.size());
        assertEquals(StoreOutcome.STORED, cache.store("orders by day", "q", null, "a"));
        assertEquals(1, new SemanticCache(LazyEmbeddingService.fallbackOnly(16), file).size());
    }

    @Test
    void shouldKeepEntryInMemoryWhenPersistenceFails() throws Exception {
        Path blocker = tempDir.resolve("not-a-directory");
        Files.writeString(blocker, "plain file");
        SemanticCache cache = new SemanticCache(LazyEmbeddingService.fallbackOnly(16), blocker.resolve("cache.json"));

        StoreOutcome outcome = cache.store("churn rate", "q", null, "3%");

        assertEquals(StoreOutcome.STORED_NOT_PERSISTED, outcome);
        assertEquals(1, cache.size());
        assertTrue(cache.lookup("churn rate").isPresent());
    }

    @Test
    void shouldEvictOldestEntryBeyondCapacity() {
        MutableClock clock = new MutableClock(START);
        CountingEmbeddings embeddings = new CountingEmbeddings();
        embeddings.vectors.put("a", new float[] { 1f, 0f, 0f });
        embeddings.vectors.put("b", new float[] { 0f, 1f, 0f });
        embeddings.vectors.put("c", new float[] { 0f, 0f, 1f });
        SemanticCache cache = cache(embeddings, new CachePolicy(0.95f, 2, null), clock);

        cache.store("a", "qa", null, "A");
        clock.advance(Duration.ofMinutes(1));
        cache.store("b", "qb", null, "B");
        clock.advance(Duration.ofMinutes(1));
        cache.store("c", "qc", null, "C");

        assertEquals(2, cache.size());
        assertTrue(cache.lookup("a").isEmpty());
        assertTrue(cache.lookup("c").isPresent());
        assertEquals(1, cache.stats().evictions());
    }

    @Test
    void shouldHideAndEvictExpiredEntries() {
        MutableClock clock = new MutableClock(START);
        CountingEmbeddings embeddings = new CountingEmbeddings();
        embeddings.vectors.put("a", new float[] { 1f, 0f });
        SemanticCache cache = cache(embeddings, new CachePolicy(0.95f, 0, Duration.ofHours(1)), clock);
        cache.store("a", "qa", null, "A");

        clock.advance(Duration.ofMinutes(59));
        assertTrue(cache.lookup("a").isPresent());
        clock.advance(Duration.ofMinutes(2));
        assertTrue(cache.lookup("a").isEmpty());

        assertEquals(1, cache.evictExpired());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldEmitLookupAndStoreTelemetry() {
        LatencyTracker tracker = new LatencyTracker();
        SemanticCache cache = new SemanticCache(LazyEmbeddingService.fallbackOnly(16), null, CachePolicy.defaults(),
                new MutableClock(START), tracker);

        cache.store("orders", "q", null, "a", "trace-7");
        cache.lookup("orders", "trace-7");

        assertEquals(1, tracker.stats(OperationType.CACHE_STORE).orElseThrow().count());
        assertEquals(1, tracker.stats(OperationType.CACHE_LOOKUP).orElseThrow().count());
        assertEquals(Boolean.TRUE, tracker.recordsForTrace("trace-7").stream()
                .filter(record -> record.operation() == OperationType.CACHE_LOOKUP)
                .findFirst().orElseThrow().metadata().get("hit"));
    }

    @Test
    void shouldClearAllEntries() {
        SemanticCache cache = new SemanticCache(LazyEmbeddingService.fallbackOnly(16), tempDir.resolve("c.json"));
        cache.store("orders", "q", null, "a");

        cache.clear();

        assertEquals(0, cache.size());
        assertFalse(cache.lookup("orders").isPresent());
    }

    @Test
    void shouldValidatePolicy() {
        assertThrows(IllegalArgumentException.class, () -> new CachePolicy(1.5f, 10, null));
        assertThrows(IllegalArgumentException.class, () -> new CachePolicy(0.9f, -1, null));
        assertThrows(IllegalArgumentException.class, () -> new CachePolicy(0.9f, 10, Duration.ZERO));
    }

    private static SemanticCache cache(EmbeddingService embeddings, CachePolicy policy, MutableClock clock) {
        return new SemanticCache(embeddings, null, policy, clock == null ? new MutableClock(START) : clock, null);
    }

    private static final class CountingEmbeddings implements EmbeddingService {
        private final Map<String, float[]> vectors = new HashMap<>();
        private int calls;

        @Override
        public List<float[]> embed(List<String> texts) {
            calls++;
            List<float[]> out = new ArrayList<>();
            for (String text : texts) {
                out.add(vectors.getOrDefault(text, new float[] { 0f, 0f }).clone());
            }
            return out;
        }

        @Override
        public int dimension() {
            return 2;
        }

        @Override
        public boolean isFallback() {
            return false;
        }
    }
}
