package com.mind.dashboard.catalog;

import com.mind.dashboard.aggregation.Aggregations;
import com.mind.dashboard.error.ErrorKind;

import java.time.Instant;
import java.util.*;

public class MetricModels {

    public enum Shape { NUMBER, LABEL, SERIES, TABLE, UNDEFINED }

    public record MetricValue(Shape shape,
                              Double number,
                              String label,
                              List<SeriesPoint> series,
                              List<Map<String, Object>> rows,
                              String unit) {

        public static MetricValue undefined() {
            return new MetricValue(Shape.UNDEFINED, null, null, List.of(), List.of(), null);
        }

        public static MetricValue number(OptionalDouble value, int decimals, String unit) {
            if (value.isEmpty()) return undefined();
            return new MetricValue(Shape.NUMBER, Aggregations.roundTo(value.getAsDouble(), decimals), null, List.of(), List.of(), unit);
        }

        public static MetricValue count(long value, String unit) {
            return new MetricValue(Shape.NUMBER, (double) value, null, List.of(), List.of(), unit);
        }

        public static MetricValue label(String value) {
            if (value == null) return undefined();
            return new MetricValue(Shape.LABEL, null, value, List.of(), List.of(), null);
        }

        public static MetricValue series(List<SeriesPoint> points, String unit) {
            return new MetricValue(Shape.SERIES, null, null, List.copyOf(points), List.of(), unit);
        }

        public static MetricValue table(List<Map<String, Object>> rows) {
            return new MetricValue(Shape.TABLE, null, null, List.of(), List.copyOf(rows), null);
        }

        public boolean defined() {
            return shape != Shape.UNDEFINED;
        }
    }

    public record SeriesPoint(String key, Double value) {
        public static SeriesPoint of(String key, OptionalDouble value, int decimals) {
            return new SeriesPoint(key, value.isPresent() ? Aggregations.roundTo(value.getAsDouble(), decimals) : null);
        }

        public static SeriesPoint count(String key, long value) {
            return new SeriesPoint(key, (double) value);
        }
    }

    public record MetricError(ErrorKind kind, String message, String parameter, Long retryAfterSeconds) {}

    public record MetricResponse(String metricId,
                                 MetricValue value,
                                 Instant computedAt,
                                 boolean fromCache,
                                 MetricError error) {

        public static MetricResponse success(String metricId, MetricValue value, Instant computedAt, boolean fromCache) {
            return new MetricResponse(metricId, value, computedAt, fromCache, null);
        }

        public static MetricResponse failure(String metricId, MetricError error) {
            return new MetricResponse(metricId, null, null, false, error);
        }

        public boolean ok() {
            return error == null;
        }
    }

    public record MetricSummary(String id, String label, String recordType, Set<String> parameters, String defaultWindow, long ttlSeconds) {}

    public static Map<String, Object> row(Object... columnsAndValues) {
        if (columnsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Row needs column/value pairs");
        }
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            row.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return Collections.unmodifiableMap(row);
    }

    public static Double rounded(OptionalDouble value, int decimals) {
        return value.isPresent() ? Aggregations.roundTo(value.getAsDouble(), decimals) : null;
    }
}
