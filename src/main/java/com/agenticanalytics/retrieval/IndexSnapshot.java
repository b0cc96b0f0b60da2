package com.agenticanalytics.retrieval;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexSnapshot(
        int formatVersion,
        int dimension,
        List<SnapshotDocument> documents,
        Map<String, Integer> positions) {

    public static final int CURRENT_FORMAT = 1;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SnapshotDocument(String id, String content, float[] embedding, ChunkMetadata metadata) {
    }
}
