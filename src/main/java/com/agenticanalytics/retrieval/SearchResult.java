package com.agenticanalytics.retrieval;

import java.math.BigDecimal;
import java.math.RoundingMode;

public record SearchResult(String documentId, String content, float score, ChunkMetadata metadata) {
    public SearchResult {
        metadata = metadata == null ? ChunkMetadata.empty() : metadata;
    }

    public double displayScore() {
        return BigDecimal.valueOf(score).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }

    public String chunkTypeValue() {
        String label = metadata.chunkTypeLabel();
        return label == null ? "" : label;
    }
}
