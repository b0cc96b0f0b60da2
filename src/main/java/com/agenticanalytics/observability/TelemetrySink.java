package com.agenticanalytics.observability;

import java.time.Duration;
import java.util.Map;

public interface TelemetrySink {
    void record(OperationType operation, Duration duration, String traceId, Map<String, Object> metadata);

    static TelemetrySink noop() {
        return (operation, duration, traceId, metadata) -> {
        };
    }
}
