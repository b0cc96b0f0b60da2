package com.agenticanalytics.retrieval;

import java.util.List;
import java.util.function.IntPredicate;

interface SearchBackend {
    String name();

    void rebuild(List<Document> documents);

    List<ScoredPosition> topK(float[] normalizedQuery, int k, IntPredicate filter);

    boolean supportsNativeFiltering();
}
