package com.agenticanalytics.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private IndexConfig index = new IndexConfig();
    private RerankConfig rerank = new RerankConfig();
    private CacheConfig cache = new CacheConfig();
    private TelemetryConfig telemetry = new TelemetryConfig();

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public RerankConfig getRerank() {
        return rerank;
    }

    public void setRerank(RerankConfig rerank) {
        this.rerank = rerank == null ? new RerankConfig() : rerank;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache == null ? new CacheConfig() : cache;
    }

    public TelemetryConfig getTelemetry() {
        return telemetry;
    }

    public void setTelemetry(TelemetryConfig telemetry) {
        this.telemetry = telemetry == null ? new TelemetryConfig() : telemetry;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String endpoint;
        private String apiKey;
        private String model = "all-MiniLM-L6-v2";
        private int batchSize = 32;
        private int fallbackDimension = 384;
        private long initTimeoutMs = 30000;
        private long requestTimeoutMs = 15000;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getFallbackDimension() {
            return fallbackDimension;
        }

        public void setFallbackDimension(int fallbackDimension) {
            this.fallbackDimension = fallbackDimension;
        }

        public long getInitTimeoutMs() {
            return initTimeoutMs;
        }

        public void setInitTimeoutMs(long initTimeoutMs) {
            this.initTimeoutMs = initTimeoutMs;
        }

        public long getRequestTimeoutMs() {
            return requestTimeoutMs;
        }

        public void setRequestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private String snapshotPath = "data/vector_store/vector-index.json";
        private String backend = "auto";
        private int defaultTopK = 5;

        public String getSnapshotPath() {
            return snapshotPath;
        }

        public void setSnapshotPath(String snapshotPath) {
            this.snapshotPath = snapshotPath;
        }

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RerankConfig {
        private Map<String, Float> boostFactors = defaultBoostFactors();
        private float exactMatchBoost = 1.3f;
        private float threeWordBoost = 1.2f;
        private float twoWordBoost = 1.1f;
        private float oneWordBoost = 1.05f;

        private static Map<String, Float> defaultBoostFactors() {
            Map<String, Float> defaults = new LinkedHashMap<>();
            defaults.put("table", 1.2f);
            defaults.put("metric", 1.3f);
            defaults.put("column", 1.0f);
            defaults.put("relationship", 0.9f);
            defaults.put("query", 1.1f);
            return defaults;
        }

        public Map<String, Float> getBoostFactors() {
            return boostFactors;
        }

        public void setBoostFactors(Map<String, Float> boostFactors) {
            this.boostFactors = boostFactors == null ? defaultBoostFactors() : boostFactors;
        }

        public float getExactMatchBoost() {
            return exactMatchBoost;
        }

        public void setExactMatchBoost(float exactMatchBoost) {
            this.exactMatchBoost = exactMatchBoost;
        }

        public float getThreeWordBoost() {
            return threeWordBoost;
        }

        public void setThreeWordBoost(float threeWordBoost) {
            this.threeWordBoost = threeWordBoost;
        }

        public float getTwoWordBoost() {
            return twoWordBoost;
        }

        public void setTwoWordBoost(float twoWordBoost) {
            this.twoWordBoost = twoWordBoost;
        }

        public float getOneWordBoost() {
            return oneWordBoost;
        }

        public void setOneWordBoost(float oneWordBoost) {
            this.oneWordBoost = oneWordBoost;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CacheConfig {
        private boolean enabled = true;
        private String path = "config/semantic_cache.json";
        private float similarityThreshold = 0.95f;
        private int maxEntries = 1000;
        private String ttl;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public float getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(float similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public String getTtl() {
            return ttl;
        }

        public void setTtl(String ttl) {
            this.ttl = ttl;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TelemetryConfig {
        private boolean enabled = true;
        private int windowSize = 1000;
        private long slowOperationMs = 500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public long getSlowOperationMs() {
            return slowOperationMs;
        }

        public void setSlowOperationMs(long slowOperationMs) {
            this.slowOperationMs = slowOperationMs;
        }
    }
}
