package com.agenticanalytics.retrieval;

import java.time.Duration;

import com.agenticanalytics.observability.TelemetrySink;
import com.agenticanalytics.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private EmbeddingServices() {
    }

    public static LazyEmbeddingService fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient,
            TelemetrySink telemetrySink) {
        String endpoint = firstNonBlank(System.getenv("AGENTIC_EMBEDDING_URL"), config.getEndpoint());
        String apiKey = firstNonBlank(System.getenv("AGENTIC_EMBEDDING_API_KEY"), config.getApiKey());
        Duration initTimeout = Duration.ofMillis(config.getInitTimeoutMs());
        if (endpoint == null) {
            return new LazyEmbeddingService(null, config.getFallbackDimension(), config.getBatchSize(), initTimeout,
                    telemetrySink);
        }
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                .build();
        return new LazyEmbeddingService(
                () -> new HttpEmbeddingBackend(client, endpoint, apiKey, config.getModel()),
                config.getFallbackDimension(),
                config.getBatchSize(),
                initTimeout,
                telemetrySink);
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return null;
    }
}
