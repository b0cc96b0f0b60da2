package com.agenticanalytics.retrieval;

import java.util.List;

public record EmbeddingResult(
        List<float[]> embeddings,
        String modelName,
        int dimension,
        int count,
        double durationMs,
        boolean fallback) {
}
