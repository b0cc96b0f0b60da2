package com.agenticanalytics.observability;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LatencyTracker implements TelemetrySink {
    private static final Logger log = LoggerFactory.getLogger(LatencyTracker.class);

    private final Map<OperationType, Deque<LatencyRecord>> records = new EnumMap<>(OperationType.class);
    private final int windowSize;
    private final long slowOperationMs;
    private final Clock clock;

    public LatencyTracker() {
        this(1000, 0L, Clock.systemUTC());
    }

    public LatencyTracker(int windowSize, long slowOperationMs, Clock clock) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        this.windowSize = windowSize;
        this.slowOperationMs = slowOperationMs;
        this.clock = clock;
        for (OperationType type : OperationType.values()) {
            records.put(type, new ArrayDeque<>());
        }
    }

    @Override
    public synchronized void record(OperationType operation, Duration duration, String traceId, Map<String, Object> metadata) {
        Deque<LatencyRecord> window = records.get(operation);
        if (window.size() == windowSize) {
            window.removeFirst();
        }
        LatencyRecord record = new LatencyRecord(operation, duration, clock.instant(), traceId, Collections.unmodifiableMap(new LinkedHashMap<>(metadata)));
        window.addLast(record);
        if (slowOperationMs > 0 && duration.toMillis() >= slowOperationMs) {
            log.warn("Slow {} operation traceId={} durationMs={} metadata={}",
                    operation.value(), traceId, duration.toMillis(), metadata);
        }
    }

    public synchronized Optional<LatencyStats> stats(OperationType operation) {
        Deque<LatencyRecord> window = records.get(operation);
        if (window.isEmpty()) {
            return Optional.empty();
        }
        double[] sorted = window.stream().mapToDouble(LatencyRecord::durationMs).sorted().toArray();
        double total = 0d;
        for (double value : sorted) {
            total += value;
        }
        return Optional.of(new LatencyStats(
                operation,
                sorted.length,
                sorted[0],
                sorted[sorted.length - 1],
                total / sorted.length,
                percentile(sorted, 50),
                percentile(sorted, 95),
                percentile(sorted, 99),
                total));
    }

    public synchronized Map<OperationType, LatencyStats> allStats() {
        Map<OperationType, LatencyStats> out = new EnumMap<>(OperationType.class);
        for (OperationType type : OperationType.values()) {
            stats(type).ifPresent(stats -> out.put(type, stats));
        }
        return out;
    }

    public synchronized List<LatencyRecord> recordsForTrace(String traceId) {
        List<LatencyRecord> out = new ArrayList<>();
        for (Deque<LatencyRecord> window : records.values()) {
            for (LatencyRecord record : window) {
                if (traceId != null && traceId.equals(record.traceId())) {
                    out.add(record);
                }
            }
        }
        out.sort(Comparator.comparing(LatencyRecord::recordedAt));
        return out;
    }

    public synchronized void reset() {
        records.values().forEach(Deque::clear);
    }

    // linear interpolation between closest ranks
    static double percentile(double[] sorted, double percentile) {
        if (sorted.length == 0) {
            return 0d;
        }
        double rank = (sorted.length - 1) * (percentile / 100d);
        int lower = (int) rank;
        int upper = lower + 1;
        if (upper >= sorted.length) {
            return sorted[sorted.length - 1];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }
}
