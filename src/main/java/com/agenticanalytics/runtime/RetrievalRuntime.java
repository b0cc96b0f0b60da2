package com.agenticanalytics.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agenticanalytics.agent.RetrievalService;
import com.agenticanalytics.cache.CachePolicy;
import com.agenticanalytics.cache.SemanticCache;
import com.agenticanalytics.observability.LatencyTracker;
import com.agenticanalytics.observability.TelemetrySink;
import com.agenticanalytics.retrieval.ChunkType;
import com.agenticanalytics.retrieval.EmbeddingServices;
import com.agenticanalytics.retrieval.IngestionService;
import com.agenticanalytics.retrieval.LazyEmbeddingService;
import com.agenticanalytics.retrieval.LexicalBoosts;
import com.agenticanalytics.retrieval.LocalJsonVectorIndex;
import com.agenticanalytics.retrieval.Reranker;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import okhttp3.OkHttpClient;

public final class RetrievalRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetrievalRuntime.class);

    private final AppConfig config;
    private final OkHttpClient httpClient;
    private final LatencyTracker latencyTracker;
    private final LazyEmbeddingService embeddingService;
    private final LocalJsonVectorIndex index;
    private final Reranker reranker;
    private final SemanticCache cache;
    private final RetrievalService retrievalService;
    private final IngestionService ingestionService;
    private final Path snapshotPath;

    private RetrievalRuntime(AppConfig config, OkHttpClient httpClient, Clock clock) throws IOException {
        this.config = config;
        this.httpClient = httpClient;
        this.latencyTracker = new LatencyTracker(config.getTelemetry().getWindowSize(),
                config.getTelemetry().getSlowOperationMs(), clock);
        TelemetrySink sink = config.getTelemetry().isEnabled() ? latencyTracker : TelemetrySink.noop();

        this.embeddingService = EmbeddingServices.fromConfig(config.getEmbedding(), httpClient, sink);
        this.index = new LocalJsonVectorIndex(embeddingService, config.getIndex().getBackend(), sink);
        this.snapshotPath = Path.of(config.getIndex().getSnapshotPath());
        index.load(snapshotPath);
        this.reranker = new Reranker(boostFactors(config.getRerank()), lexicalBoosts(config.getRerank()), sink);
        this.cache = config.getCache().isEnabled()
                ? new SemanticCache(embeddingService, Path.of(config.getCache().getPath()), cachePolicy(config.getCache()),
                        clock, sink)
                : null;
        this.retrievalService = new RetrievalService(index, reranker, cache, sink);
        this.ingestionService = new IngestionService(index);
        log.info("Retrieval runtime ready documents={} backend={} cacheEnabled={}",
                index.count(), index.backendName(), cache != null);
    }

    public static RetrievalRuntime start(AppConfig config) throws IOException {
        return new RetrievalRuntime(config, new OkHttpClient(), Clock.systemUTC());
    }

    public static RetrievalRuntime start(AppConfig config, OkHttpClient httpClient, Clock clock) throws IOException {
        return new RetrievalRuntime(config, httpClient, clock);
    }

    public static AppConfig loadConfig(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config = mapper.readValue(path.toFile(), AppConfig.class);
        return config == null ? new AppConfig() : config;
    }

    static Map<ChunkType, Float> boostFactors(AppConfig.RerankConfig rerank) {
        Map<ChunkType, Float> factors = new EnumMap<>(ChunkType.class);
        rerank.getBoostFactors().forEach((type, factor) -> {
            if (factor != null) {
                factors.put(ChunkType.fromValue(type), factor);
            }
        });
        return factors;
    }

    static LexicalBoosts lexicalBoosts(AppConfig.RerankConfig rerank) {
        return new LexicalBoosts(rerank.getExactMatchBoost(), rerank.getThreeWordBoost(), rerank.getTwoWordBoost(),
                rerank.getOneWordBoost());
    }

    static CachePolicy cachePolicy(AppConfig.CacheConfig cache) {
        Duration ttl = cache.getTtl() == null || cache.getTtl().isBlank() ? null : Duration.parse(cache.getTtl());
        return new CachePolicy(cache.getSimilarityThreshold(), cache.getMaxEntries(), ttl);
    }

    public AppConfig config() {
        return config;
    }

    public LatencyTracker latencyTracker() {
        return latencyTracker;
    }

    public LazyEmbeddingService embeddingService() {
        return embeddingService;
    }

    public LocalJsonVectorIndex index() {
        return index;
    }

    public Reranker reranker() {
        return reranker;
    }

    public SemanticCache cache() {
        return cache;
    }

    public RetrievalService retrievalService() {
        return retrievalService;
    }

    public IngestionService ingestionService() {
        return ingestionService;
    }

    public Path snapshotPath() {
        return snapshotPath;
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
