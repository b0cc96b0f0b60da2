package com.agenticanalytics.retrieval;

import java.util.List;
import java.util.function.IntPredicate;

class ExactSearchBackend implements SearchBackend {
    private List<Document> documents = List.of();

    @Override
    public String name() {
        return "exact";
    }

    @Override
    public void rebuild(List<Document> documents) {
        this.documents = List.copyOf(documents);
    }

    @Override
    public List<ScoredPosition> topK(float[] normalizedQuery, int k, IntPredicate filter) {
        TopKCollector collector = new TopKCollector(k);
        for (int position = 0; position < documents.size(); position++) {
            if (filter != null && !filter.test(position)) {
                continue;
            }
            float[] vector = Vectors.normalized(documents.get(position).embedding());
            collector.offer(position, Vectors.dot(normalizedQuery, vector));
        }
        return collector.sorted();
    }

    @Override
    public boolean supportsNativeFiltering() {
        return true;
    }
}
