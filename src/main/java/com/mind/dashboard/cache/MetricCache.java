package com.mind.dashboard.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.mind.dashboard.catalog.EffectiveFilters;
import com.mind.dashboard.catalog.MetricDefinition;
import com.mind.dashboard.catalog.MetricModels.MetricValue;
import com.mind.dashboard.config.DashboardProperties;
import com.mind.dashboard.error.DataUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Memoizes metric results per {@code (metric id, canonical filters)}.
 * <p>
 * Each entry lives for the TTL of its metric. A miss installs a pending future and is computed by the
 * requesting thread outside the map lock; concurrent requests for the same key wait on that future,
 * other keys proceed independently. A computation that throws leaves nothing behind.
 */
@Component
public class MetricCache {
    private static final Logger log = LoggerFactory.getLogger(MetricCache.class);

    private final AsyncCache<CacheKey, CachedResult> cache;
    private final Clock clock;
    private final DashboardProperties.Cache settings;

    public MetricCache(DashboardProperties properties, Clock clock, Ticker cacheTicker) {
        this.clock = clock;
        this.settings = properties.cache();
        this.cache = Caffeine.newBuilder()
                .maximumSize(settings.maximumSize())
                .expireAfter(new Expiry<CacheKey, CachedResult>() {
                    @Override
                    public long expireAfterCreate(CacheKey key, CachedResult value, long currentTime) {
                        return value.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(CacheKey key, CachedResult value, long currentTime, long currentDuration) {
                        return value.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(CacheKey key, CachedResult value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .ticker(cacheTicker)
                .recordStats()
                .buildAsync();
    }

    public CacheLookup getOrCompute(MetricDefinition definition, EffectiveFilters filters, Supplier<MetricValue> computeFn) {
        CacheKey key = new CacheKey(definition.id(), filters.canonicalKey());
        CompletableFuture<CachedResult> pending = new CompletableFuture<>();
        AtomicBoolean created = new AtomicBoolean(false);
        CompletableFuture<CachedResult> future = cache.get(key, (k, executor) -> {
            created.set(true);
            return pending;
        });
        if (!created.get()) {
            return new CacheLookup(await(future), true);
        }

        log.debug("Cache miss for {}", key);
        try {
            CachedResult result = new CachedResult(computeFn.get(), clock.instant(), ttlFor(definition));
            pending.complete(result);
            return new CacheLookup(result, false);
        } catch (RuntimeException | Error e) {
            pending.completeExceptionally(e);
            throw e;
        }
    }

    /** Configured override for the metric, else the metric's own TTL. */
    public Duration ttlFor(MetricDefinition definition) {
        Long override = settings.ttlSecondsByMetric().get(definition.id());
        return override != null ? Duration.ofSeconds(override) : definition.ttl();
    }

    public void invalidateAll() {
        long size = cache.synchronous().estimatedSize();
        cache.synchronous().invalidateAll();
        log.info("Invalidated all cached metrics (~{} entries)", size);
    }

    public int invalidate(String metricId) {
        var keys = cache.asMap().keySet().stream().filter(k -> k.metricId().equals(metricId)).toList();
        cache.synchronous().invalidateAll(keys);
        log.info("Invalidated {} cached entries of {}", keys.size(), metricId);
        return keys.size();
    }

    public CacheStatistics statistics() {
        CacheStats stats = cache.synchronous().stats();
        return new CacheStatistics(cache.synchronous().estimatedSize(), stats.hitCount(), stats.missCount(), stats.evictionCount(), stats.hitRate());
    }

    @Scheduled(fixedDelayString = "${dashboard.cache.maintenance-delay-ms:60000}")
    public void scheduledCleanUp() {
        cache.synchronous().cleanUp();
    }

    private static CachedResult await(CompletableFuture<CachedResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) throw runtime;
            if (cause instanceof Error error) throw error;
            throw new DataUnavailableException("Metric computation failed", null, cause);
        }
    }
}
