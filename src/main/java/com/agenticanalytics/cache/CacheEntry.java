package com.agenticanalytics.cache;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheEntry(
        String query,
        String generatedQuery,
        JsonNode resultPayload,
        String answer,
        float[] embedding,
        Instant createdAt) {

    public CacheEntry {
        embedding = embedding == null ? null : embedding.clone();
    }

    @Override
    public float[] embedding() {
        return embedding == null ? null : embedding.clone();
    }
}
