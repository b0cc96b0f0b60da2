package com.agenticanalytics.retrieval;

public record Document(String id, String content, float[] embedding, ChunkMetadata metadata) {
    public Document {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("document id must not be blank");
        }
        content = content == null ? "" : content;
        metadata = metadata == null ? ChunkMetadata.empty() : metadata;
    }
}
