package com.mind.dashboard.cache;

import com.mind.dashboard.catalog.MetricModels.MetricValue;

import java.time.Duration;
import java.time.Instant;

public record CachedResult(MetricValue value, Instant computedAt, Duration ttl) {}
