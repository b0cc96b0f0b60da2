package com.agenticanalytics.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentInput(String id, String content, ChunkMetadata metadata, float[] embedding) {
    public DocumentInput {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("document id must not be blank");
        }
        content = content == null ? "" : content;
        metadata = metadata == null ? ChunkMetadata.empty() : metadata;
    }

    public DocumentInput(String id, String content, ChunkMetadata metadata) {
        this(id, content, metadata, null);
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }
}
