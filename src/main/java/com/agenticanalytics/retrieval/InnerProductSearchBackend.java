package com.agenticanalytics.retrieval;

import java.util.List;
import java.util.function.IntPredicate;

class InnerProductSearchBackend implements SearchBackend {
    private float[] matrix = new float[0];
    private int rows;
    private int dimension;

    @Override
    public String name() {
        return "inner-product";
    }

    @Override
    public void rebuild(List<Document> documents) {
        if (documents.isEmpty()) {
            matrix = new float[0];
            rows = 0;
            dimension = 0;
            return;
        }
        int dim = documents.get(0).embedding().length;
        float[] next = new float[documents.size() * dim];
        for (int row = 0; row < documents.size(); row++) {
            float[] normalized = Vectors.normalized(documents.get(row).embedding());
            System.arraycopy(normalized, 0, next, row * dim, dim);
        }
        matrix = next;
        rows = documents.size();
        dimension = dim;
    }

    @Override
    public List<ScoredPosition> topK(float[] normalizedQuery, int k, IntPredicate filter) {
        if (filter != null) {
            throw new UnsupportedOperationException("inner-product backend cannot filter natively");
        }
        TopKCollector collector = new TopKCollector(k);
        for (int row = 0; row < rows; row++) {
            int offset = row * dimension;
            float dot = 0f;
            for (int i = 0; i < dimension; i++) {
                dot += normalizedQuery[i] * matrix[offset + i];
            }
            collector.offer(row, dot);
        }
        return collector.sorted();
    }

    @Override
    public boolean supportsNativeFiltering() {
        return false;
    }
}
