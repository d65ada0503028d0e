package com.mind.dashboard.catalog;

import com.mind.dashboard.catalog.MetricModels.MetricValue;
import com.mind.dashboard.config.DashboardProperties;
import com.mind.dashboard.domain.Role;
import com.mind.dashboard.error.ValidationException;
import com.mind.dashboard.repository.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.*;
import java.util.stream.Stream;

@Component
public class MetricCatalog {
    private static final Logger log = LoggerFactory.getLogger(MetricCatalog.class);

    private final Map<String, MetricDefinition> definitions;
    private final RecordStore store;
    private final Clock clock;
    private final DashboardProperties properties;

    @Autowired
    public MetricCatalog(RecordStore store, Clock clock, DashboardProperties properties) {
        this(store, clock, properties, Stream.of(
                AccountMetrics.definitions(),
                GradeMetrics.definitions(),
                TelemetryMetrics.definitions()
        ).flatMap(List::stream).toList());
    }

    MetricCatalog(RecordStore store, Clock clock, DashboardProperties properties, List<MetricDefinition> definitions) {
        this.store = store;
        this.clock = clock;
        this.properties = properties;
        Map<String, MetricDefinition> byId = new LinkedHashMap<>();
        for (MetricDefinition d : definitions) {
            if (byId.putIfAbsent(d.id(), d) != null) {
                throw new IllegalStateException("Duplicate metric id: " + d.id());
            }
        }
        this.definitions = Collections.unmodifiableMap(byId);
        log.info("Metric catalog loaded with {} definitions", byId.size());
    }

    public Optional<MetricDefinition> find(String metricId) {
        return Optional.ofNullable(metricId).map(definitions::get);
    }

    public MetricDefinition definition(String metricId) {
        return find(metricId).orElseThrow(() -> new ValidationException("metricId", "Unknown metric '" + metricId + "'"));
    }

    public Collection<MetricDefinition> definitions() {
        return definitions.values();
    }

    public List<MetricDefinition> visibleTo(Role role) {
        return definitions.values().stream().filter(d -> d.visibleTo(role)).toList();
    }

    public void validate(MetricDefinition definition, MetricParams params) {
        params.supplied().stream()
                .filter(p -> !definition.accepts(p))
                .findFirst()
                .ifPresent(p -> {
                    throw new ValidationException(p.key(), "Metric '" + definition.id() + "' does not accept '" + p.key() + "'");
                });
    }

    public MetricValue resolve(String metricId, EffectiveFilters filters) {
        MetricDefinition definition = definition(metricId);
        MetricContext context = new MetricContext(filters, store, clock,
                properties.timeBucketWeekStartDay(), properties.zone());
        long started = System.nanoTime();
        MetricValue value = definition.pipeline().compute(context);
        log.debug("Computed {} [{}] in {} ms", metricId, filters.canonicalKey(), (System.nanoTime() - started) / 1_000_000);
        return value == null ? MetricValue.undefined() : value;
    }
}
