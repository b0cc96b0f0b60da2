package com.agenticanalytics.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class LatencyTrackerTest {
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldComputeStatisticsPerOperation() {
        LatencyTracker tracker = new LatencyTracker(100, 0L, clock);
        for (int ms = 10; ms <= 100; ms += 10) {
            tracker.record(OperationType.RETRIEVAL, Duration.ofMillis(ms), null, Map.of());
        }

        LatencyStats stats = tracker.stats(OperationType.RETRIEVAL).orElseThrow();

        assertEquals(10, stats.count());
        assertEquals(10d, stats.minMs(), 1e-9);
        assertEquals(100d, stats.maxMs(), 1e-9);
        assertEquals(55d, stats.meanMs(), 1e-9);
        assertEquals(55d, stats.medianMs(), 1e-9);
        assertEquals(95.5d, stats.p95Ms(), 1e-9);
        assertEquals(550d, stats.totalMs(), 1e-9);
        assertTrue(tracker.stats(OperationType.EMBEDDING).isEmpty());
    }

    @Test
    void shouldKeepOnlyMostRecentWindow() {
        LatencyTracker tracker = new LatencyTracker(3, 0L, clock);
        for (int ms = 1; ms <= 5; ms++) {
            tracker.record(OperationType.EMBEDDING, Duration.ofMillis(ms), null, Map.of());
        }

        LatencyStats stats = tracker.stats(OperationType.EMBEDDING).orElseThrow();

        assertEquals(3, stats.count());
        assertEquals(3d, stats.minMs(), 1e-9);
        assertEquals(5d, stats.maxMs(), 1e-9);
    }

    @Test
    void shouldInterpolatePercentiles() {
        double[] sorted = { 1d, 2d, 3d, 4d };

        assertEquals(2.5d, LatencyTracker.percentile(sorted, 50), 1e-9);
        assertEquals(4d, LatencyTracker.percentile(sorted, 100), 1e-9);
        assertEquals(1d, LatencyTracker.percentile(sorted, 0), 1e-9);
        assertEquals(0d, LatencyTracker.percentile(new double[0], 95), 1e-9);
    }

    @Test
    void shouldGroupRecordsByTraceAndReset() {
        LatencyTracker tracker = new LatencyTracker(10, 1L, clock);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("model", null);
        tracker.record(OperationType.CACHE_LOOKUP, Duration.ofMillis(3), "t-1", metadata);
        tracker.record(OperationType.TOTAL_REQUEST, Duration.ofMillis(9), "t-1", Map.of("cached", false));
        tracker.record(OperationType.RETRIEVAL, Duration.ofMillis(4), "t-2", Map.of());

        List<LatencyRecord> trace = tracker.recordsForTrace("t-1");

        assertEquals(2, trace.size());
        assertTrue(trace.get(0).metadata().containsKey("model"));
        assertEquals(3, tracker.allStats().size());
        assertEquals(9d, trace.get(1).durationMs(), 1e-9);

        tracker.reset();
        assertTrue(tracker.allStats().isEmpty());
        assertFalse(tracker.recordsForTrace("t-2").iterator().hasNext());
    }

    @Test
    void shouldSwallowFailingSinkInEmitter() {
        TelemetryEmitter emitter = new TelemetryEmitter((operation, duration, traceId, metadata) -> {
            throw new IllegalStateException("sink down");
        });

        emitter.emit(OperationType.RERANKING, System.nanoTime(), "t-3", Map.of());
    }

    @Test
    void shouldRejectNonPositiveWindow() {
        assertThrows(IllegalArgumentException.class, () -> new LatencyTracker(0, 0L, clock));
    }
}
