package com.mind.dashboard.repository;

import java.time.Instant;

// Half-open [from, to); a null bound is unbounded.
public record TimeRange(Instant from, Instant to) {
    public static final TimeRange UNBOUNDED = new TimeRange(null, null);

    public TimeRange {
        if (from != null && to != null && !from.isBefore(to)) {
            throw new IllegalArgumentException("Time range start must be before its end: " + from + " .. " + to);
        }
    }

    public boolean contains(Instant ts) {
        if (ts == null) return false;
        return (from == null || !ts.isBefore(from)) && (to == null || ts.isBefore(to));
    }
}
