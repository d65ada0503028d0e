package com.mind.dashboard.aggregation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.*;
import java.util.function.Function;

/**
 * Statistical building blocks shared by every metric.
 * <p>
 * None of these throw for missing data: an empty or all-null input yields an empty
 * {@link OptionalDouble}, which callers must keep distinct from a numeric zero.
 */
public final class Aggregations {

    private Aggregations() {}

    public static OptionalDouble mean(Collection<? extends Number> values) {
        return nonNull(values).stream().mapToDouble(Double::doubleValue).average();
    }

    public static OptionalDouble sum(Collection<? extends Number> values) {
        List<Double> present = nonNull(values);
        if (present.isEmpty()) return OptionalDouble.empty();
        return OptionalDouble.of(present.stream().mapToDouble(Double::doubleValue).sum());
    }

    public static OptionalDouble min(Collection<? extends Number> values) {
        return nonNull(values).stream().mapToDouble(Double::doubleValue).min();
    }

    public static OptionalDouble max(Collection<? extends Number> values) {
        return nonNull(values).stream().mapToDouble(Double::doubleValue).max();
    }

    public static long countNonNull(Collection<?> values) {
        return values == null ? 0 : values.stream().filter(Objects::nonNull).count();
    }

    /**
     * Continuous percentile with linear interpolation between closest ranks,
     * {@code h = p * (n - 1)} over the ascending non-null values. The input is not modified.
     */
    public static OptionalDouble percentile(Collection<? extends Number> values, double p) {
        if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("Percentile must be within [0,1]: " + p);
        }
        double[] sorted = nonNull(values).stream().mapToDouble(Double::doubleValue).sorted().toArray();
        if (sorted.length == 0) return OptionalDouble.empty();

        double h = p * (sorted.length - 1);
        int lo = (int) Math.floor(h);
        int hi = (int) Math.ceil(h);
        return OptionalDouble.of(sorted[lo] + (h - lo) * (sorted[hi] - sorted[lo]));
    }

    public static OptionalDouble rate(long numerator, long denominator) {
        if (denominator == 0) return OptionalDouble.empty();
        return OptionalDouble.of((double) numerator / denominator);
    }

    /**
     * Partitions {@code records} by key, keeping the order in which keys first occur, and
     * aggregates each partition. Null keys are grouped under {@code null}.
     */
    public static <T, K, R> LinkedHashMap<K, R> groupBy(Collection<T> records,
                                                        Function<? super T, ? extends K> keyFn,
                                                        Function<List<T>, ? extends R> aggFn) {
        Map<K, List<T>> partitions = new LinkedHashMap<>();
        for (T record : records) {
            partitions.computeIfAbsent(keyFn.apply(record), k -> new ArrayList<>()).add(record);
        }
        LinkedHashMap<K, R> out = new LinkedHashMap<>();
        partitions.forEach((key, rows) -> out.put(key, aggFn.apply(rows)));
        return out;
    }

    /**
     * Assigns records to calendar-aligned buckets in {@code zone}. Weeks start on {@code weekStart}.
     * Buckets are keyed by their start instant and iterate in ascending order. Records
     * without a timestamp are skipped.
     */
    public static <T> TreeMap<Instant, List<T>> bucketByTime(Collection<T> records,
                                                             Function<? super T, Instant> timestampFn,
                                                             Granularity granularity,
                                                             DayOfWeek weekStart,
                                                             ZoneId zone) {
        TreeMap<Instant, List<T>> buckets = new TreeMap<>();
        for (T record : records) {
            Instant ts = timestampFn.apply(record);
            if (ts == null) continue;
            buckets.computeIfAbsent(bucketStart(ts, granularity, weekStart, zone), k -> new ArrayList<>()).add(record);
        }
        return buckets;
    }

    public static Instant bucketStart(Instant ts, Granularity granularity, DayOfWeek weekStart, ZoneId zone) {
        ZonedDateTime local = ts.atZone(zone);
        return switch (granularity) {
            case HOUR -> local.truncatedTo(ChronoUnit.HOURS).toInstant();
            case DAY -> local.truncatedTo(ChronoUnit.DAYS).toInstant();
            case WEEK -> local.truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.previousOrSame(weekStart))
                    .toInstant();
        };
    }

    /**
     * For every position {@code i} aggregates the points {@code max(0, i - windowSize + 1) .. i}.
     * Leading positions use the points available; nothing is padded.
     */
    public static <R> List<R> rollingWindow(List<Double> orderedSeries,
                                            int windowSize,
                                            Function<List<Double>, R> aggFn) {
        if (windowSize < 1) throw new IllegalArgumentException("Window size must be positive: " + windowSize);
        List<R> out = new ArrayList<>(orderedSeries.size());
        for (int i = 0; i < orderedSeries.size(); i++) {
            int start = Math.max(0, i - windowSize + 1);
            out.add(aggFn.apply(orderedSeries.subList(start, i + 1)));
        }
        return out;
    }

    /**
     * Label of the highest boundary not above {@code value}; the highest bucket is open-ended
     * and values below the lowest boundary fall into the lowest bucket.
     */
    public static Optional<String> histogramBucket(Double value, List<Boundary> boundaries) {
        if (value == null || value.isNaN() || boundaries.isEmpty()) return Optional.empty();
        List<Boundary> descending = boundaries.stream()
                .sorted(Comparator.comparingDouble(Boundary::lower).reversed())
                .toList();
        for (Boundary b : descending) {
            if (value >= b.lower()) return Optional.of(b.label());
        }
        return Optional.of(descending.get(descending.size() - 1).label());
    }

    public static Double valueOrNull(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    public static double roundTo(double value, int decimals) {
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }

    public static OptionalDouble toPercent(OptionalDouble ratio) {
        return ratio.isPresent() ? OptionalDouble.of(ratio.getAsDouble() * 100.0) : ratio;
    }

    private static List<Double> nonNull(Collection<? extends Number> values) {
        if (values == null) return List.of();
        return values.stream()
                .filter(Objects::nonNull)
                .map(Number::doubleValue)
                .filter(v -> !v.isNaN())
                .toList();
    }
}
