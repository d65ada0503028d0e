package com.mind.dashboard;

import com.mind.dashboard.aggregation.Aggregations;
import com.mind.dashboard.aggregation.Boundary;
import com.mind.dashboard.aggregation.Granularity;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class AggregationsTest {

    @Test
    void percentileEndpointsMatchMinAndMax() {
        List<Double> values = List.of(42.0, 7.0, 19.5, 88.0, 63.25);
        assertEquals(Aggregations.min(values), Aggregations.percentile(values, 0.0));
        assertEquals(Aggregations.max(values), Aggregations.percentile(values, 1.0));
    }

    @Test
    void percentileInterpolatesBetweenRanks() {
        List<Integer> values = List.of(10, 20, 30, 40);
        assertEquals(25.0, Aggregations.percentile(values, 0.5).getAsDouble(), 1e-9);
        assertEquals(37.0, Aggregations.percentile(values, 0.9).getAsDouble(), 1e-9);
    }

    @Test
    void percentileLeavesInputUntouched() {
        List<Double> values = new ArrayList<>(List.of(3.0, 1.0, 2.0));
        Aggregations.percentile(values, 0.5);
        assertEquals(List.of(3.0, 1.0, 2.0), values);
    }

    @Test
    void percentileOutsideUnitIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Aggregations.percentile(List.of(1.0), 1.5));
        assertThrows(IllegalArgumentException.class, () -> Aggregations.percentile(List.of(1.0), -0.1));
    }

    @Test
    void emptyAndAllNullInputsAreUndefined() {
        List<Double> nulls = Arrays.asList(null, null);
        assertTrue(Aggregations.mean(List.of()).isEmpty());
        assertTrue(Aggregations.mean(nulls).isEmpty());
        assertTrue(Aggregations.sum(nulls).isEmpty());
        assertTrue(Aggregations.min(nulls).isEmpty());
        assertTrue(Aggregations.max(List.of()).isEmpty());
        assertTrue(Aggregations.percentile(nulls, 0.95).isEmpty());
        assertEquals(0, Aggregations.countNonNull(nulls));
    }

    @Test
    void nullsAreSkippedNotCountedAsZero() {
        List<Double> values = Arrays.asList(80.0, null, 60.0);
        assertEquals(70.0, Aggregations.mean(values).getAsDouble(), 1e-9);
        assertEquals(2, Aggregations.countNonNull(values));
    }

    @Test
    void rateWithZeroDenominatorIsUndefined() {
        assertTrue(Aggregations.rate(0, 0).isEmpty());
        assertEquals(0.25, Aggregations.rate(1, 4).getAsDouble(), 1e-9);
        assertEquals(25.0, Aggregations.toPercent(Aggregations.rate(1, 4)).getAsDouble(), 1e-9);
        assertTrue(Aggregations.toPercent(OptionalDouble.empty()).isEmpty());
    }

    @Test
    void groupByKeepsFirstOccurrenceOrder() {
        var grouped = Aggregations.groupBy(List.of("beta", "alpha", "bravo", "apple", "charlie"),
                s -> s.substring(0, 1), List::size);
        assertEquals(List.of("b", "a", "c"), new ArrayList<>(grouped.keySet()));
        assertEquals(Map.of("a", 2, "b", 2, "c", 1), grouped);
    }

    @Test
    void weeklyBucketsAlignToConfiguredWeekStart() {
        // 2024-03-13 is a Wednesday
        Instant wednesday = Instant.parse("2024-03-13T15:30:00Z");
        assertEquals(Instant.parse("2024-03-11T00:00:00Z"),
                Aggregations.bucketStart(wednesday, Granularity.WEEK, DayOfWeek.MONDAY, ZoneOffset.UTC));
        assertEquals(Instant.parse("2024-03-10T00:00:00Z"),
                Aggregations.bucketStart(wednesday, Granularity.WEEK, DayOfWeek.SUNDAY, ZoneOffset.UTC));
    }

    @Test
    void dailyBucketsFollowTheZone() {
        Instant lateEvening = Instant.parse("2024-03-13T23:30:00Z");
        assertEquals(Instant.parse("2024-03-13T00:00:00Z"),
                Aggregations.bucketStart(lateEvening, Granularity.DAY, DayOfWeek.MONDAY, ZoneOffset.UTC));
        assertEquals(Instant.parse("2024-03-13T23:00:00Z"),
                Aggregations.bucketStart(lateEvening, Granularity.DAY, DayOfWeek.MONDAY, ZoneId.of("Europe/Berlin")));
    }

    @Test
    void bucketByTimeIsAscendingAndSkipsMissingTimestamps() {
        List<Instant> stamps = Arrays.asList(
                Instant.parse("2024-03-13T10:15:00Z"),
                null,
                Instant.parse("2024-03-13T08:59:59Z"),
                Instant.parse("2024-03-13T10:45:00Z"));
        var buckets = Aggregations.bucketByTime(stamps, ts -> ts, Granularity.HOUR, DayOfWeek.MONDAY, ZoneOffset.UTC);
        assertEquals(List.of(Instant.parse("2024-03-13T08:00:00Z"), Instant.parse("2024-03-13T10:00:00Z")),
                new ArrayList<>(buckets.keySet()));
        assertEquals(2, buckets.get(Instant.parse("2024-03-13T10:00:00Z")).size());
    }

    @Test
    void rollingWindowUsesAvailablePointsAtTheStart() {
        List<Double> series = List.of(10.0, 20.0, 30.0, 40.0);
        List<Double> rolled = Aggregations.rollingWindow(series, 3,
                window -> Aggregations.mean(window).getAsDouble());
        assertEquals(List.of(10.0, 15.0, 20.0, 30.0), rolled);
        assertThrows(IllegalArgumentException.class, () -> Aggregations.rollingWindow(series, 0, List::size));
    }

    @Test
    void histogramBucketPicksHighestBoundaryNotAboveValue() {
        List<Boundary> boundaries = List.of(Boundary.of(0, "fast"), Boundary.of(100, "ok"), Boundary.of(500, "slow"));
        assertEquals("fast", Aggregations.histogramBucket(99.9, boundaries).orElseThrow());
        assertEquals("ok", Aggregations.histogramBucket(100.0, boundaries).orElseThrow());
        assertEquals("slow", Aggregations.histogramBucket(10_000.0, boundaries).orElseThrow());
        assertEquals("fast", Aggregations.histogramBucket(-5.0, boundaries).orElseThrow());
        assertTrue(Aggregations.histogramBucket(null, boundaries).isEmpty());
    }

    @Test
    void roundingIsHalfUp() {
        assertEquals(2.35, Aggregations.roundTo(2.345, 2), 1e-12);
        assertEquals(92.0, Aggregations.roundTo(91.96, 1), 1e-12);
    }
}
