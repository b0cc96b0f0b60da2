package com.agenticanalytics.cache;

public record CacheHit(CacheEntry entry, float similarity) {
}
