package com.mind.dashboard.aggregation;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Granularity {
    HOUR("hour"),
    DAY("day"),
    WEEK("week");

    private final String token;

    Granularity(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static Optional<Granularity> fromToken(String raw) {
        if (raw == null) return Optional.empty();
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(g -> g.token.equals(normalized)).findFirst();
    }
}
