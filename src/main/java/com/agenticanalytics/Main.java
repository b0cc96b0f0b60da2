package com.agenticanalytics;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agenticanalytics.cache.CacheHit;
import com.agenticanalytics.cache.CacheStats;
import com.agenticanalytics.cache.SemanticCache;
import com.agenticanalytics.cache.StoreOutcome;
import com.agenticanalytics.observability.LatencyStats;
import com.agenticanalytics.observability.OperationType;
import com.agenticanalytics.retrieval.IngestionReport;
import com.agenticanalytics.retrieval.SearchResult;
import com.agenticanalytics.runtime.AppConfig;
import com.agenticanalytics.runtime.RetrievalRuntime;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "agentic-retrieval",
        mixinStandardHelpOptions = true,
        version = "agentic-retrieval 0.1.0",
        description = "Semantic retrieval and caching core for analytics questions.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+");

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "search")
    Mode mode;

    @Option(names = "--documents", description = "JSON array of {id, content, metadata} for ingest mode")
    Path documentsPath;

    @Option(names = "--clear", description = "Clear the index before ingesting", defaultValue = "false")
    boolean clearExisting;

    @Option(names = "--query", description = "Question text for search and cache modes")
    String query;

    @Option(names = "--top-k", description = "Results to return (defaults to index.defaultTopK)")
    Integer topK;

    @Option(names = "--filter", description = "Metadata equality filter, e.g. --filter chunk_type=metric")
    Map<String, String> filter;

    @Option(names = "--diversity-key", description = "Select results round-robin across values of this metadata key")
    String diversityKey;

    @Option(names = "--no-rerank", description = "Return raw similarity order", defaultValue = "false")
    boolean skipRerank;

    @Option(names = "--document-id", description = "Document id for delete mode")
    String documentId;

    @Option(names = "--generated-query", description = "Generated analytical query for cache-store mode")
    String generatedQuery;

    @Option(names = "--answer", description = "Natural-language answer for cache-store mode")
    String answer;

    @Option(names = "--payload", description = "JSON result payload for cache-store mode", defaultValue = "{}")
    String payload;

    @Option(names = "--trace-id", description = "Trace id attached to telemetry events")
    String traceId;

    enum Mode {
        ingest,
        search,
        delete,
        cacheLookup,
        cacheStore,
        stats
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws IOException {
        AppConfig config = RetrievalRuntime.loadConfig(Path.of(configPath));
        String trace = traceId == null || traceId.isBlank() ? UUID.randomUUID().toString() : traceId;
        log.info("Starting agentic-retrieval in {} mode traceId={}", mode, trace);
        log.info("Using config file: {}", configPath);

        try (RetrievalRuntime runtime = RetrievalRuntime.start(config)) {
            return switch (mode) {
                case ingest -> runIngest(runtime, trace);
                case search -> runSearch(runtime, trace);
                case delete -> runDelete(runtime);
                case cacheLookup -> runCacheLookup(runtime, trace);
                case cacheStore -> runCacheStore(runtime, trace);
                case stats -> runStats(runtime);
            };
        }
    }

    private int runIngest(RetrievalRuntime runtime, String trace) throws IOException {
        if (documentsPath == null) {
            log.error("--documents is required in ingest mode");
            return 2;
        }
        IngestionReport report = runtime.ingestionService()
                .ingest(documentsPath, runtime.snapshotPath(), clearExisting, trace);
        log.info("Ingestion finished ingested={} total={} durationMs={} fallbackEmbeddings={}",
                report.documentsIngested(),
                report.totalDocuments(),
                report.durationMs(),
                runtime.embeddingService().isFallback());
        report.errors().forEach(error -> log.error("Ingestion error: {}", error));
        return report.success() ? 0 : 1;
    }

    private int runSearch(RetrievalRuntime runtime, String trace) {
        if (query == null || query.isBlank()) {
            log.error("--query is required in search mode");
            return 2;
        }
        int k = effectiveTopK(runtime);
        Map<String, Object> metadataFilter = parseFilter(filter);
        List<SearchResult> results;
        if (diversityKey != null && !diversityKey.isBlank()) {
            List<SearchResult> candidates = runtime.index().search(query,
                    (int) Math.min(Integer.MAX_VALUE, (long) k * 3), metadataFilter, trace);
            results = runtime.reranker().diversityRerank(candidates, diversityKey, k);
        } else if (skipRerank) {
            results = runtime.index().search(query, k, metadataFilter, trace);
        } else {
            results = runtime.retrievalService().retrieve(query, k, metadataFilter, trace);
        }
        if (results.isEmpty()) {
            log.info("No results for query '{}'", query);
        }
        for (int i = 0; i < results.size(); i++) {
            SearchResult result = results.get(i);
            log.info("Result #{} id={} score={} metadata={} content={}",
                    i + 1,
                    result.documentId(),
                    String.format(Locale.ROOT, "%.4f", result.displayScore()),
                    result.metadata(),
                    abbreviate(result.content()));
        }
        return 0;
    }

    private int runDelete(RetrievalRuntime runtime) throws IOException {
        if (documentId == null || documentId.isBlank()) {
            log.error("--document-id is required in delete mode");
            return 2;
        }
        if (!runtime.index().deleteDocument(documentId)) {
            log.warn("Document {} not found", documentId);
            return 1;
        }
        runtime.index().save(runtime.snapshotPath());
        log.info("Deleted document {} remaining={}", documentId, runtime.index().count());
        return 0;
    }

    private int runCacheLookup(RetrievalRuntime runtime, String trace) {
        SemanticCache cache = runtime.cache();
        if (cache == null) {
            log.error("Semantic cache is disabled in {}", configPath);
            return 2;
        }
        if (query == null || query.isBlank()) {
            log.error("--query is required in cache-lookup mode");
            return 2;
        }
        Optional<CacheHit> hit = cache.lookup(query, trace);
        if (hit.isEmpty()) {
            log.info("Cache miss for '{}'", query);
            return 0;
        }
        log.info("Cache hit similarity={} cachedQuery='{}' generatedQuery={} answer={}",
                String.format(Locale.ROOT, "%.4f", hit.get().similarity()),
                hit.get().entry().query(),
                hit.get().entry().generatedQuery(),
                hit.get().entry().answer());
        return 0;
    }

    private int runCacheStore(RetrievalRuntime runtime, String trace) throws IOException {
        SemanticCache cache = runtime.cache();
        if (cache == null) {
            log.error("Semantic cache is disabled in {}", configPath);
            return 2;
        }
        if (query == null || answer == null) {
            log.error("--query and --answer are required in cache-store mode");
            return 2;
        }
        JsonNode resultPayload = new ObjectMapper().readTree(payload);
        StoreOutcome outcome = cache.store(query, generatedQuery, resultPayload, answer, trace);
        log.info("Cache store outcome={} entries={}", outcome, cache.size());
        return outcome == StoreOutcome.STORED_NOT_PERSISTED ? 1 : 0;
    }

    private int runStats(RetrievalRuntime runtime) {
        log.info("Index documents={} dimension={} backend={} embeddingModel={} fallbackEmbeddings={}",
                runtime.index().count(),
                runtime.index().dimension(),
                runtime.index().backendName(),
                runtime.embeddingService().modelName(),
                runtime.embeddingService().isFallback());
        if (runtime.cache() != null) {
            CacheStats stats = runtime.cache().stats();
            log.info("Cache entries={} threshold={} maxEntries={}",
                    stats.entries(),
                    runtime.cache().policy().similarityThreshold(),
                    runtime.cache().policy().maxEntries());
        }
        Map<OperationType, LatencyStats> latency = runtime.latencyTracker().allStats();
        latency.forEach((operation, stats) -> log.info("Latency {} count={} meanMs={} p95Ms={}",
                operation.value(),
                stats.count(),
                String.format(Locale.ROOT, "%.3f", stats.meanMs()),
                String.format(Locale.ROOT, "%.3f", stats.p95Ms())));
        return 0;
    }

    private int effectiveTopK(RetrievalRuntime runtime) {
        int configured = runtime.config().getIndex().getDefaultTopK();
        int k = topK == null ? configured : topK;
        return Math.max(1, k);
    }

    static Map<String, Object> parseFilter(Map<String, String> raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        Map<String, Object> parsed = new LinkedHashMap<>();
        raw.forEach((key, value) -> parsed.put(key, parseScalar(value)));
        return parsed;
    }

    static Object parseScalar(String value) {
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            return Boolean.parseBoolean(value);
        }
        if (INTEGER.matcher(value).matches()) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                return value;
            }
        }
        if (DECIMAL.matcher(value).matches()) {
            return Double.parseDouble(value);
        }
        return value;
    }

    private static String abbreviate(String content) {
        String flattened = content.strip().replaceAll("\\s+", " ");
        return flattened.length() > 160 ? flattened.substring(0, 160) + "..." : flattened;
    }
}
