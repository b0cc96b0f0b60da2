package com.agenticanalytics.cache;

public record CacheStats(int entries, long hits, long misses, long stores, long evictions) {
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0d : (double) hits / lookups;
    }
}
