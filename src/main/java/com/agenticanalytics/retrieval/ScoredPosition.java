package com.agenticanalytics.retrieval;

import java.util.Comparator;

// score descending, then insertion position ascending
record ScoredPosition(int position, float score) {
    static final Comparator<ScoredPosition> RANKING = Comparator
            .comparing(ScoredPosition::score, Comparator.reverseOrder())
            .thenComparingInt(ScoredPosition::position);
}
