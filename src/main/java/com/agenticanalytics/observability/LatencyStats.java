package com.agenticanalytics.observability;

public record LatencyStats(
        OperationType operation,
        int count,
        double minMs,
        double maxMs,
        double meanMs,
        double medianMs,
        double p95Ms,
        double p99Ms,
        double totalMs) {
}
