package com.mind.dashboard;

import com.mind.dashboard.aggregation.Granularity;
import com.mind.dashboard.catalog.EffectiveFilters;
import com.mind.dashboard.catalog.MetricParams;
import com.mind.dashboard.catalog.TimeWindow;
import com.mind.dashboard.error.ValidationException;
import com.mind.dashboard.repository.TimeRange;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricParamsTest {

    @Test
    void parsesTypedValues() {
        var params = MetricParams.parse(Map.of(
                "window", "Last_7_Days",
                "threshold", "65.5",
                "granularity", "week",
                "limit", "25"));
        assertEquals(TimeWindow.LAST_7_DAYS, params.window());
        assertEquals(65.5, params.threshold());
        assertEquals(Granularity.WEEK, params.granularity());
        assertEquals(25, params.limit());
    }

    @Test
    void rejectsUnknownAndMalformedParameters() {
        assertEquals("color", assertThrows(ValidationException.class,
                () -> MetricParams.parse(Map.of("color", "red"))).parameter());
        assertEquals("threshold", assertThrows(ValidationException.class,
                () -> MetricParams.parse(Map.of("threshold", "101"))).parameter());
        assertEquals("limit", assertThrows(ValidationException.class,
                () -> MetricParams.parse(Map.of("limit", "ten"))).parameter());
        assertEquals("owner", assertThrows(ValidationException.class,
                () -> MetricParams.parse(Map.of("owner", "x' OR 1=1"))).parameter());
        assertThrows(ValidationException.class, () -> MetricParams.parse(Map.of("window", "fortnight")));
        assertThrows(ValidationException.class, () -> MetricParams.parse(Map.of("slaMs", "0")));
    }

    @Test
    void searchTermIsBoundedAndCaseFoldedInTheKey() {
        assertEquals("Ada O'Neil", MetricParams.parse(Map.of("search", " Ada O'Neil ")).search());
        assertEquals("search", assertThrows(ValidationException.class,
                () -> MetricParams.parse(Map.of("search", "a".repeat(65)))).parameter());
        assertEquals("search", assertThrows(ValidationException.class,
                () -> MetricParams.parse(Map.of("search", "%' OR 1=1 --"))).parameter());

        var upper = new EffectiveFilters(TimeWindow.ALL_TIME, null, null, null, null, null, null, null, null, null, null, "ADA");
        var lower = new EffectiveFilters(TimeWindow.ALL_TIME, null, null, null, null, null, null, null, null, null, null, "ada");
        assertEquals(lower.canonicalKey(), upper.canonicalKey());
    }

    @Test
    void customWindowNeedsOrderedBounds() {
        var window = TimeWindow.parse("custom", "2024-01-01T00:00:00Z", "2024-02-01T00:00:00Z");
        assertEquals(new TimeRange(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-02-01T00:00:00Z")),
                window.resolve(Clock.systemUTC(), ZoneOffset.UTC));
        assertThrows(ValidationException.class, () -> TimeWindow.parse("custom", "2024-02-01T00:00:00Z", "2024-01-01T00:00:00Z"));
        assertThrows(ValidationException.class, () -> TimeWindow.parse("custom", "2024-02-01T00:00:00Z", null));
        assertThrows(ValidationException.class, () -> TimeWindow.parse("7d", "2024-02-01T00:00:00Z", null));
    }

    @Test
    void relativeWindowsResolveAgainstTheClock() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-13T15:30:00Z"), ZoneOffset.UTC);
        assertEquals(Instant.parse("2024-03-06T15:30:00Z"), TimeWindow.LAST_7_DAYS.resolve(clock, ZoneOffset.UTC).from());
        assertEquals(Instant.parse("2024-03-13T00:00:00Z"), TimeWindow.TODAY.resolve(clock, ZoneOffset.UTC).from());
        assertEquals(TimeRange.UNBOUNDED, TimeWindow.ALL_TIME.resolve(clock, ZoneOffset.UTC));
    }

    @Test
    void windowAliasesShareACanonicalKey() {
        var viaAlias = EffectiveFilters.ofWindow(MetricParams.parse(Map.of("window", "last_30_days")).window());
        var viaToken = EffectiveFilters.ofWindow(MetricParams.parse(Map.of("window", "30d")).window());
        assertEquals(viaToken.canonicalKey(), viaAlias.canonicalKey());
        assertEquals("window=30d", viaToken.canonicalKey());
    }
}
