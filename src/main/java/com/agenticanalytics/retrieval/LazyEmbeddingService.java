package com.agenticanalytics.retrieval;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agenticanalytics.observability.OperationType;
import com.agenticanalytics.observability.TelemetryEmitter;
import com.agenticanalytics.observability.TelemetrySink;

/**
 * Embedding service that loads its backend on first use. The load runs at most
 * once per instance, even under concurrent first calls, and is bounded by a
 * timeout. When no backend is configured or the load fails, the service degrades
 * permanently to {@link DeterministicEmbeddingService} and reports
 * {@link #isFallback()}.
 */
public class LazyEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(LazyEmbeddingService.class);
    private static final String WARMUP_TEXT = "test";

    private final Callable<EmbeddingBackend> loader;
    private final DeterministicEmbeddingService fallback;
    private final int batchSize;
    private final Duration initTimeout;
    private final TelemetryEmitter telemetry;
    private final Object initLock = new Object();
    private volatile LoadedBackend loaded;

    public LazyEmbeddingService(Callable<EmbeddingBackend> loader, int fallbackDimension, int batchSize,
            Duration initTimeout, TelemetrySink telemetrySink) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.loader = loader;
        this.fallback = new DeterministicEmbeddingService(fallbackDimension);
        this.batchSize = batchSize;
        this.initTimeout = initTimeout;
        this.telemetry = new TelemetryEmitter(telemetrySink);
    }

    public static LazyEmbeddingService fallbackOnly(int dimension) {
        return new LazyEmbeddingService(null, dimension, 32, Duration.ZERO, TelemetrySink.noop());
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        return embedBatch(texts, null).embeddings();
    }

    @Override
    public List<float[]> embed(List<String> texts, String traceId) {
        return embedBatch(texts, traceId).embeddings();
    }

    public EmbeddingResult embedBatch(List<String> texts, String traceId) {
        LoadedBackend backend = ensureLoaded();
        long start = System.nanoTime();
        List<float[]> out = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            List<String> batch = texts.subList(from, Math.min(texts.size(), from + batchSize));
            List<float[]> vectors = backend.encode(batch, fallback);
            for (float[] vector : vectors) {
                if (vector.length != backend.dimension()) {
                    throw new DimensionMismatchException(backend.dimension(), vector.length);
                }
                out.add(vector);
            }
        }
        double durationMs = (System.nanoTime() - start) / 1_000_000d;
        telemetry.emit(OperationType.EMBEDDING, start, traceId,
                Map.of("count", texts.size(), "model", String.valueOf(backend.modelName())));
        return new EmbeddingResult(out, backend.modelName(), backend.dimension(), out.size(), durationMs,
                backend.isFallback());
    }

    @Override
    public int dimension() {
        return ensureLoaded().dimension();
    }

    @Override
    public boolean isFallback() {
        return ensureLoaded().isFallback();
    }

    @Override
    public String modelName() {
        return ensureLoaded().modelName();
    }

    private LoadedBackend ensureLoaded() {
        LoadedBackend current = loaded;
        if (current != null) {
            return current;
        }
        synchronized (initLock) {
            if (loaded == null) {
                loaded = load();
            }
            return loaded;
        }
    }

    private LoadedBackend load() {
        if (loader == null) {
            log.warn("No embedding backend configured; using deterministic fallback embeddings dimension={}",
                    fallback.dimension());
            return LoadedBackend.fallback(fallback);
        }
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<LoadedBackend> future = executor.submit(() -> {
                EmbeddingBackend backend = loader.call();
                List<float[]> warmup = backend.encode(List.of(WARMUP_TEXT));
                if (warmup.isEmpty() || warmup.get(0).length == 0) {
                    throw new IOException("Embedding backend returned an empty warmup vector");
                }
                return new LoadedBackend(backend, warmup.get(0).length, backend.modelName());
            });
            LoadedBackend result = initTimeout.isZero() || initTimeout.isNegative()
                    ? future.get()
                    : future.get(initTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Loaded embedding backend model={} dimension={}", result.modelName(), result.dimension());
            return result;
        } catch (TimeoutException e) {
            log.warn("Embedding backend did not load within {} ms; using deterministic fallback embeddings",
                    initTimeout.toMillis());
        } catch (ExecutionException e) {
            log.warn("Embedding backend unavailable; using deterministic fallback embeddings", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while loading embedding backend; using deterministic fallback embeddings");
        } finally {
            executor.shutdownNow();
        }
        return LoadedBackend.fallback(fallback);
    }

    private record LoadedBackend(EmbeddingBackend backend, int dimension, String modelName) {
        static LoadedBackend fallback(DeterministicEmbeddingService fallback) {
            return new LoadedBackend(null, fallback.dimension(), fallback.modelName());
        }

        boolean isFallback() {
            return backend == null;
        }

        List<float[]> encode(List<String> batch, DeterministicEmbeddingService fallback) {
            if (backend == null) {
                return fallback.embed(batch);
            }
            List<float[]> vectors;
            try {
                vectors = backend.encode(batch);
            } catch (IOException e) {
                throw new EmbeddingException("Embedding backend " + modelName + " failed", e);
            }
            if (vectors.size() != batch.size()) {
                throw new EmbeddingException("Embedding backend " + modelName + " returned " + vectors.size()
                        + " vectors for " + batch.size() + " inputs", null);
            }
            return vectors;
        }
    }
}
