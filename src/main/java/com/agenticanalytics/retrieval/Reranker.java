package com.agenticanalytics.retrieval;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agenticanalytics.observability.OperationType;
import com.agenticanalytics.observability.TelemetryEmitter;
import com.agenticanalytics.observability.TelemetrySink;

public class Reranker {
    private static final Logger log = LoggerFactory.getLogger(Reranker.class);

    public static final String ORIGINAL_SCORE = "original_score";
    public static final String ORIGINAL_RANK = "original_rank";
    public static final String DEFAULT_GROUP = "other";

    private final Map<ChunkType, Float> boostFactors;
    private final LexicalBoosts lexicalBoosts;
    private final TelemetrySink telemetrySink;
    private final TelemetryEmitter telemetry;

    public Reranker() {
        this(defaultBoostFactors(), LexicalBoosts.defaults(), TelemetrySink.noop());
    }

    public Reranker(Map<ChunkType, Float> boostFactors, LexicalBoosts lexicalBoosts, TelemetrySink telemetrySink) {
        EnumMap<ChunkType, Float> copy = new EnumMap<>(ChunkType.class);
        copy.putAll(boostFactors);
        this.boostFactors = Collections.unmodifiableMap(copy);
        this.lexicalBoosts = lexicalBoosts;
        this.telemetrySink = telemetrySink;
        this.telemetry = new TelemetryEmitter(telemetrySink);
    }

    public static Map<ChunkType, Float> defaultBoostFactors() {
        Map<ChunkType, Float> defaults = new EnumMap<>(ChunkType.class);
        defaults.put(ChunkType.TABLE, 1.2f);
        defaults.put(ChunkType.METRIC, 1.3f);
        defaults.put(ChunkType.COLUMN, 1.0f);
        defaults.put(ChunkType.RELATIONSHIP, 0.9f);
        defaults.put(ChunkType.QUERY, 1.1f);
        return defaults;
    }

    public List<SearchResult> rerank(List<SearchResult> results, String query) {
        return rerank(results, query, null, null);
    }

    /**
     * Scores each result as {@code score * typeBoost * lexicalBoost} and sorts
     * descending, keeping input order among equal scores. Each output carries its
     * pre-rerank score and rank as {@value #ORIGINAL_SCORE} / {@value #ORIGINAL_RANK}.
     *
     * @param boosts replaces the configured type boosts for this call when non-empty
     * @param topK   all results when null or not positive
     */
    public List<SearchResult> rerank(List<SearchResult> results, String query, Integer topK,
            Map<ChunkType, Float> boosts) {
        if (results == null || results.isEmpty()) {
            return List.of();
        }
        long start = System.nanoTime();
        Map<ChunkType, Float> factors = boosts == null || boosts.isEmpty() ? boostFactors : boosts;
        String normalizedQuery = query == null ? "" : query.toLowerCase(Locale.ROOT);
        Set<String> queryWords = words(normalizedQuery);

        List<Ranked> ranked = new ArrayList<>(results.size());
        for (int rank = 0; rank < results.size(); rank++) {
            SearchResult result = results.get(rank);
            ChunkType type = result.metadata().chunkType();
            float typeBoost = type == null ? 1.0f : factors.getOrDefault(type, 1.0f);
            float queryBoost = normalizedQuery.isBlank() ? 1.0f : lexicalBoost(normalizedQuery, queryWords, result);
            ranked.add(new Ranked(result, rank, result.score() * typeBoost * queryBoost));
        }
        ranked.sort(Comparator.comparing(Ranked::finalScore, Comparator.reverseOrder()));

        int limit = topK == null || topK <= 0 ? ranked.size() : Math.min(topK, ranked.size());
        List<SearchResult> out = new ArrayList<>(limit);
        for (Ranked item : ranked.subList(0, limit)) {
            Map<String, Object> audit = new LinkedHashMap<>();
            audit.put(ORIGINAL_SCORE, item.result().score());
            audit.put(ORIGINAL_RANK, item.originalRank());
            out.add(new SearchResult(item.result().documentId(), item.result().content(), item.finalScore(),
                    item.result().metadata().withAttributes(audit)));
        }
        log.debug("Reranked {} candidates, returning {}", results.size(), out.size());
        telemetry.emit(OperationType.RERANKING, start, null, Map.of("candidates", results.size(), "returned", out.size()));
        return out;
    }

    public List<SearchResult> diversityRerank(List<SearchResult> results, String diversityKey, int topK) {
        if (results == null || results.isEmpty() || topK <= 0) {
            return List.of();
        }
        Map<String, List<SearchResult>> groups = new LinkedHashMap<>();
        for (SearchResult result : results) {
            Object value = result.metadata().get(diversityKey);
            String key = value == null ? DEFAULT_GROUP : value.toString();
            groups.computeIfAbsent(key, unused -> new ArrayList<>()).add(result);
        }

        List<SearchResult> diversified = new ArrayList<>(Math.min(topK, results.size()));
        int round = 0;
        boolean added = true;
        while (diversified.size() < topK && added) {
            added = false;
            for (List<SearchResult> group : groups.values()) {
                if (round < group.size()) {
                    diversified.add(group.get(round));
                    added = true;
                    if (diversified.size() == topK) {
                        break;
                    }
                }
            }
            round++;
        }
        return diversified;
    }

    public Reranker withBoostFactor(ChunkType chunkType, float factor) {
        Map<ChunkType, Float> updated = new EnumMap<>(ChunkType.class);
        updated.putAll(boostFactors);
        updated.put(chunkType, factor);
        return new Reranker(updated, lexicalBoosts, telemetrySink);
    }

    public Map<ChunkType, Float> boostFactors() {
        return boostFactors;
    }

    public LexicalBoosts lexicalBoosts() {
        return lexicalBoosts;
    }

    private float lexicalBoost(String normalizedQuery, Set<String> queryWords, SearchResult result) {
        String content = result.content().toLowerCase(Locale.ROOT);
        if (content.contains(normalizedQuery)) {
            return lexicalBoosts.exactMatch();
        }
        Set<String> contentWords = words(content);
        int shared = 0;
        for (String word : queryWords) {
            if (contentWords.contains(word)) {
                shared++;
            }
        }
        return lexicalBoosts.forOverlap(shared);
    }

    private static Set<String> words(String text) {
        Set<String> out = new HashSet<>(Arrays.asList(text.trim().split("\\s+")));
        out.remove("");
        return out;
    }

    private record Ranked(SearchResult result, int originalRank, float finalScore) {
    }
}
