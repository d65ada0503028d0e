package com.mind.dashboard.service;

import com.mind.dashboard.cache.CacheLookup;
import com.mind.dashboard.cache.CacheStatistics;
import com.mind.dashboard.cache.MetricCache;
import com.mind.dashboard.catalog.EffectiveFilters;
import com.mind.dashboard.catalog.MetricCatalog;
import com.mind.dashboard.catalog.MetricDefinition;
import com.mind.dashboard.catalog.MetricModels.MetricError;
import com.mind.dashboard.catalog.MetricModels.MetricResponse;
import com.mind.dashboard.catalog.MetricModels.MetricSummary;
import com.mind.dashboard.catalog.MetricParams;
import com.mind.dashboard.catalog.Param;
import com.mind.dashboard.domain.Role;
import com.mind.dashboard.error.AuthorizationException;
import com.mind.dashboard.error.DataUnavailableException;
import com.mind.dashboard.error.ErrorKind;
import com.mind.dashboard.error.MetricException;
import com.mind.dashboard.error.ValidationException;
import com.mind.dashboard.scoping.CallerContext;
import com.mind.dashboard.scoping.RoleScopingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

@Service
public class MetricQueryService {
    private static final Logger log = LoggerFactory.getLogger(MetricQueryService.class);

    private final MetricCatalog catalog;
    private final RoleScopingService scoping;
    private final MetricCache cache;

    public MetricQueryService(MetricCatalog catalog, RoleScopingService scoping, MetricCache cache) {
        this.catalog = catalog;
        this.scoping = scoping;
        this.cache = cache;
    }

    public MetricResponse query(String metricId, Map<String, String> rawParams, CallerContext caller) {
        try {
            scoping.requireCaller(caller);
            MetricParams params = MetricParams.parse(rawParams);
            scoping.guardOwnership(params, caller);

            MetricDefinition definition = catalog.definition(metricId);
            catalog.validate(definition, params);
            EffectiveFilters filters = scoping.scope(definition, params, caller);

            CacheLookup lookup = cache.getOrCompute(definition, filters, () -> catalog.resolve(definition.id(), filters));
            return MetricResponse.success(definition.id(), lookup.result().value(), lookup.result().computedAt(), lookup.fromCache());
        } catch (MetricException e) {
            log.debug("Metric {} rejected for {}: {}", metricId, caller, e.getMessage());
            return MetricResponse.failure(metricId, toError(e));
        } catch (RuntimeException e) {
            log.error("Metric {} failed for {}", metricId, caller, e);
            return MetricResponse.failure(metricId, new MetricError(ErrorKind.INTERNAL, "Metric computation failed", null, null));
        }
    }

    public List<MetricSummary> catalogFor(CallerContext caller) {
        scoping.requireCaller(caller);
        return catalog.visibleTo(caller.role()).stream()
                .map(d -> new MetricSummary(d.id(), d.label(), d.recordType().name(),
                        new TreeSet<>(d.parameters().stream().map(Param::key).toList()),
                        d.defaultWindow().canonical(), cache.ttlFor(d).toSeconds()))
                .toList();
    }

    public void invalidateAll(CallerContext caller) {
        requireAdmin(caller);
        cache.invalidateAll();
    }

    public int invalidate(String metricId, CallerContext caller) {
        requireAdmin(caller);
        catalog.definition(metricId);
        return cache.invalidate(metricId);
    }

    public CacheStatistics cacheStatistics(CallerContext caller) {
        requireAdmin(caller);
        return cache.statistics();
    }

    private void requireAdmin(CallerContext caller) {
        scoping.requireCaller(caller);
        if (caller.role() != Role.ADMIN) {
            throw new AuthorizationException("Only admins may manage the metric cache");
        }
    }

    private static MetricError toError(MetricException e) {
        if (e instanceof ValidationException v) {
            return new MetricError(e.kind(), e.getMessage(), v.parameter(), null);
        }
        if (e instanceof DataUnavailableException d) {
            return new MetricError(e.kind(), e.getMessage(), null, d.retryAfter() == null ? null : d.retryAfter().toSeconds());
        }
        return new MetricError(e.kind(), e.getMessage(), null, null);
    }
}
