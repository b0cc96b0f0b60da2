package com.agenticanalytics.observability;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record LatencyRecord(
        OperationType operation,
        Duration duration,
        Instant recordedAt,
        String traceId,
        Map<String, Object> metadata) {

    public double durationMs() {
        return duration.toNanos() / 1_000_000d;
    }
}
