package com.agenticanalytics.cache;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agenticanalytics.observability.OperationType;
import com.agenticanalytics.observability.TelemetryEmitter;
import com.agenticanalytics.observability.TelemetrySink;
import com.agenticanalytics.retrieval.EmbeddingService;
import com.agenticanalytics.retrieval.Vectors;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Cache of answered questions keyed by embedding similarity instead of exact
 * text. A lookup scans every live entry and hits when the best cosine
 * similarity reaches the configured threshold.
 *
 * <p>Entries are append-only. Capacity is bounded by evicting the oldest entry,
 * and entries older than the optional TTL are invisible to lookups and dropped on
 * the next store. Every store rewrites the whole backing file.
 */
public class SemanticCache {
    private static final Logger log = LoggerFactory.getLogger(SemanticCache.class);

    private final EmbeddingService embeddingService;
    private final CacheFileStore fileStore;
    private final Path persistencePath;
    private final CachePolicy policy;
    private final Clock clock;
    private final TelemetryEmitter telemetry;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<CacheEntry> entries = new ArrayList<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong stores = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public SemanticCache(EmbeddingService embeddingService, Path persistencePath, CachePolicy policy, Clock clock,
            TelemetrySink telemetrySink) {
        this.embeddingService = embeddingService;
        this.fileStore = new CacheFileStore();
        this.persistencePath = persistencePath;
        this.policy = policy;
        this.clock = clock;
        this.telemetry = new TelemetryEmitter(telemetrySink);
        loadPersisted();
    }

    public SemanticCache(EmbeddingService embeddingService, Path persistencePath) {
        this(embeddingService, persistencePath, CachePolicy.defaults(), Clock.systemUTC(), TelemetrySink.noop());
    }

    public Optional<CacheHit> lookup(String query) {
        return lookup(query, null);
    }

    public Optional<CacheHit> lookup(String query, String traceId) {
        long start = System.nanoTime();
        if (size() == 0) {
            misses.incrementAndGet();
            telemetry.emit(OperationType.CACHE_LOOKUP, start, traceId, Map.of("hit", false));
            return Optional.empty();
        }
        float[] queryVector = embeddingService.embedOne(query);
        Optional<CacheHit> hit;
        lock.readLock().lock();
        try {
            hit = bestMatch(queryVector);
        } finally {
            lock.readLock().unlock();
        }
        if (hit.isPresent()) {
            hits.incrementAndGet();
            log.info("Semantic cache hit query='{}' matched='{}' similarity={}",
                    query, hit.get().entry().query(), String.format("%.4f", hit.get().similarity()));
        } else {
            misses.incrementAndGet();
        }
        telemetry.emit(OperationType.CACHE_LOOKUP, start, traceId, Map.of("hit", hit.isPresent()));
        return hit;
    }

    public StoreOutcome store(String query, String generatedQuery, JsonNode resultPayload, String answer) {
        return store(query, generatedQuery, resultPayload, answer, null);
    }

    public StoreOutcome store(String query, String generatedQuery, JsonNode resultPayload, String answer,
            String traceId) {
        long start = System.nanoTime();
        float[] queryVector = embeddingService.embedOne(query);
        StoreOutcome outcome;
        lock.writeLock().lock();
        try {
            if (bestMatch(queryVector).isPresent()) {
                log.debug("Skipping cache store for '{}': near-duplicate already cached", query);
                outcome = StoreOutcome.SKIPPED_DUPLICATE;
            } else {
                entries.add(new CacheEntry(query, generatedQuery,
                        resultPayload == null ? NullNode.getInstance() : resultPayload,
                        answer, queryVector, clock.instant()));
                stores.incrementAndGet();
                purgeExpired();
                enforceCapacity();
                outcome = persist() ? StoreOutcome.STORED : StoreOutcome.STORED_NOT_PERSISTED;
                log.debug("Cached query '{}' entries={}", query, entries.size());
            }
        } finally {
            lock.writeLock().unlock();
        }
        telemetry.emit(OperationType.CACHE_STORE, start, traceId, Map.of("outcome", outcome.name()));
        return outcome;
    }

    public int evictExpired() {
        lock.writeLock().lock();
        try {
            int removed = purgeExpired();
            if (removed > 0) {
                persist();
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            persist();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<CacheEntry> entries() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheStats stats() {
        return new CacheStats(size(), hits.get(), misses.get(), stores.get(), evictions.get());
    }

    public CachePolicy policy() {
        return policy;
    }

    private Optional<CacheHit> bestMatch(float[] queryVector) {
        Instant now = clock.instant();
        CacheEntry best = null;
        float bestScore = Float.NEGATIVE_INFINITY;
        for (CacheEntry entry : entries) {
            if (isExpired(entry, now)) {
                continue;
            }
            float[] embedding = entry.embedding();
            if (embedding.length != queryVector.length) {
                continue;
            }
            float score = Vectors.cosine(queryVector, embedding);
            if (score > bestScore) {
                bestScore = score;
                best = entry;
            }
        }
        if (best != null && bestScore >= policy.similarityThreshold()) {
            return Optional.of(new CacheHit(best, bestScore));
        }
        return Optional.empty();
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return policy.ttl() != null && entry.createdAt() != null
                && entry.createdAt().plus(policy.ttl()).isBefore(now);
    }

    private int purgeExpired() {
        if (policy.ttl() == null) {
            return 0;
        }
        Instant now = clock.instant();
        int before = entries.size();
        entries.removeIf(entry -> isExpired(entry, now));
        int removed = before - entries.size();
        evictions.addAndGet(removed);
        return removed;
    }

    private void enforceCapacity() {
        if (policy.maxEntries() == 0) {
            return;
        }
        Comparator<CacheEntry> oldestFirst = Comparator.comparing(CacheEntry::createdAt,
                Comparator.nullsFirst(Comparator.naturalOrder()));
        while (entries.size() > policy.maxEntries()) {
            CacheEntry oldest = entries.stream().min(oldestFirst).orElseThrow();
            entries.remove(oldest);
            evictions.incrementAndGet();
            log.debug("Evicted cached query '{}' to respect capacity {}", oldest.query(), policy.maxEntries());
        }
    }

    private boolean persist() {
        if (persistencePath == null) {
            return true;
        }
        try {
            fileStore.save(persistencePath, entries);
            return true;
        } catch (IOException e) {
            log.warn("Unable to persist semantic cache to {}; {} entries remain in memory only",
                    persistencePath, entries.size(), e);
            return false;
        }
    }

    private void loadPersisted() {
        if (persistencePath == null) {
            return;
        }
        try {
            List<CacheEntry> loaded = fileStore.load(persistencePath);
            loaded.removeIf(entry -> entry == null || entry.embedding() == null || entry.query() == null);
            entries.addAll(loaded);
            if (!loaded.isEmpty()) {
                log.info("Loaded {} cached queries from {}", loaded.size(), persistencePath);
            }
        } catch (IOException e) {
            log.warn("Unable to read semantic cache {}; starting empty", persistencePath, e);
        }
    }
}
