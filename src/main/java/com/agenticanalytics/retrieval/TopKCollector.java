package com.agenticanalytics.retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

final class TopKCollector {
    private final int k;
    private final PriorityQueue<ScoredPosition> heap;

    TopKCollector(int k) {
        this.k = k;
        this.heap = new PriorityQueue<>(Math.max(1, k), ScoredPosition.RANKING.reversed());
    }

    void offer(int position, float score) {
        // + 0f folds -0.0 into 0.0 so equal scores tie on position
        ScoredPosition candidate = new ScoredPosition(position, score + 0f);
        if (heap.size() < k) {
            heap.add(candidate);
            return;
        }
        if (ScoredPosition.RANKING.compare(candidate, heap.peek()) < 0) {
            heap.poll();
            heap.add(candidate);
        }
    }

    List<ScoredPosition> sorted() {
        List<ScoredPosition> out = new ArrayList<>(heap);
        out.sort(ScoredPosition.RANKING);
        return out;
    }
}
