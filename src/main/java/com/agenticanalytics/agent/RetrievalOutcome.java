package com.agenticanalytics.agent;

import java.util.List;

import com.agenticanalytics.retrieval.SearchResult;

public record RetrievalOutcome(
        String question,
        GeneratedAnswer answer,
        List<SearchResult> context,
        boolean cached,
        float similarity) {

    static RetrievalOutcome cached(String question, GeneratedAnswer answer, float similarity) {
        return new RetrievalOutcome(question, answer, List.of(), true, similarity);
    }

    static RetrievalOutcome fresh(String question, GeneratedAnswer answer, List<SearchResult> context) {
        return new RetrievalOutcome(question, answer, List.copyOf(context), false, 0f);
    }
}
