package com.agenticanalytics.cache;

import java.time.Duration;

// maxEntries 0 means unbounded; a null ttl never expires
public record CachePolicy(float similarityThreshold, int maxEntries, Duration ttl) {
    public CachePolicy {
        if (similarityThreshold < -1f || similarityThreshold > 1f) {
            throw new IllegalArgumentException("similarityThreshold must be within [-1, 1]");
        }
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must not be negative");
        }
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    public static CachePolicy defaults() {
        return new CachePolicy(0.95f, 1000, null);
    }
}
