package com.mind.dashboard.catalog;

import com.mind.dashboard.error.ValidationException;
import com.mind.dashboard.repository.TimeRange;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;

public record TimeWindow(Kind kind, Instant from, Instant to) {

    public enum Kind {
        TODAY("today", null),
        LAST_7_DAYS("7d", Duration.ofDays(7)),
        LAST_30_DAYS("30d", Duration.ofDays(30)),
        LAST_90_DAYS("90d", Duration.ofDays(90)),
        ALL_TIME("all", null),
        CUSTOM("custom", null);

        private final String token;
        private final Duration length;

        Kind(String token, Duration length) {
            this.token = token;
            this.length = length;
        }

        public String token() {
            return token;
        }
    }

    public static final TimeWindow TODAY = new TimeWindow(Kind.TODAY, null, null);
    public static final TimeWindow LAST_7_DAYS = new TimeWindow(Kind.LAST_7_DAYS, null, null);
    public static final TimeWindow LAST_30_DAYS = new TimeWindow(Kind.LAST_30_DAYS, null, null);
    public static final TimeWindow LAST_90_DAYS = new TimeWindow(Kind.LAST_90_DAYS, null, null);
    public static final TimeWindow ALL_TIME = new TimeWindow(Kind.ALL_TIME, null, null);

    private static final Map<String, TimeWindow> ALIASES = Map.ofEntries(
            Map.entry("today", TODAY),
            Map.entry("7d", LAST_7_DAYS),
            Map.entry("last_7_days", LAST_7_DAYS),
            Map.entry("30d", LAST_30_DAYS),
            Map.entry("last_30_days", LAST_30_DAYS),
            Map.entry("90d", LAST_90_DAYS),
            Map.entry("last_90_days", LAST_90_DAYS),
            Map.entry("all", ALL_TIME),
            Map.entry("all_time", ALL_TIME)
    );

    public TimeWindow {
        if (kind == Kind.CUSTOM) {
            if (from == null || to == null) {
                throw new ValidationException("window", "Custom window requires both 'from' and 'to'");
            }
            if (!from.isBefore(to)) {
                throw new ValidationException("window", "Custom window 'from' must be before 'to'");
            }
        } else if (from != null || to != null) {
            throw new ValidationException("window", "'from'/'to' are only accepted with window=custom");
        }
    }

    public static TimeWindow custom(Instant from, Instant to) {
        return new TimeWindow(Kind.CUSTOM, from, to);
    }

    public static TimeWindow parse(String token, String from, String to) {
        if (token == null) {
            if (from != null || to != null) {
                throw new ValidationException("window", "'from'/'to' are only accepted with window=custom");
            }
            return null;
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("custom")) {
            return custom(parseInstant("from", from), parseInstant("to", to));
        }
        TimeWindow window = ALIASES.get(normalized);
        if (window == null) {
            throw new ValidationException("window", "Unsupported window '" + token + "', expected one of today, 7d, 30d, 90d, all, custom");
        }
        if (from != null || to != null) {
            throw new ValidationException("window", "'from'/'to' are only accepted with window=custom");
        }
        return window;
    }

    public String canonical() {
        return kind == Kind.CUSTOM ? from + ".." + to : kind.token();
    }

    public TimeRange resolve(Clock clock, ZoneId zone) {
        Instant now = clock.instant();
        return switch (kind) {
            case TODAY -> new TimeRange(now.atZone(zone).truncatedTo(ChronoUnit.DAYS).toInstant(), null);
            case LAST_7_DAYS, LAST_30_DAYS, LAST_90_DAYS -> new TimeRange(now.minus(kind.length), null);
            case ALL_TIME -> TimeRange.UNBOUNDED;
            case CUSTOM -> new TimeRange(from, to);
        };
    }

    private static Instant parseInstant(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException(name, "Custom window requires '" + name + "'");
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException(name, "'" + name + "' must be an ISO-8601 instant: " + raw);
        }
    }
}
