package com.mind.dashboard.cache;

public record CacheKey(String metricId, String filterKey) {
    @Override
    public String toString() {
        return metricId + "?" + filterKey;
    }
}
