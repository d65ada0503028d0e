package com.mind.dashboard.cache;

public record CacheLookup(CachedResult result, boolean fromCache) {}
