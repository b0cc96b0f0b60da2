package com.agenticanalytics.retrieval;

import java.util.List;

public interface EmbeddingService {
    List<float[]> embed(List<String> texts);

    default List<float[]> embed(List<String> texts, String traceId) {
        return embed(texts);
    }

    default float[] embedOne(String text) {
        return embed(List.of(text)).get(0);
    }

    int dimension();

    boolean isFallback();

    default String modelName() {
        return "unknown";
    }
}
