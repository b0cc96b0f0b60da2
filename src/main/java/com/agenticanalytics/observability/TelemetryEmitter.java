package com.agenticanalytics.observability;

import java.time.Duration;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TelemetryEmitter {
    private static final Logger log = LoggerFactory.getLogger(TelemetryEmitter.class);
    private final TelemetrySink sink;

    public TelemetryEmitter(TelemetrySink sink) {
        this.sink = sink == null ? TelemetrySink.noop() : sink;
    }

    public void emit(OperationType operation, long startNanos, String traceId, Map<String, Object> metadata) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        try {
            sink.record(operation, elapsed, traceId, metadata == null ? Map.of() : metadata);
        } catch (RuntimeException e) {
            log.warn("Telemetry sink rejected {} event traceId={}", operation.value(), traceId, e);
        }
    }
}
