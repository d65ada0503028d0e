package com.mind.dashboard.cache;

public record CacheStatistics(long entries, long hits, long misses, long evictions, double hitRate) {}
