package com.mind.dashboard.domain;

import java.util.Arrays;
import java.util.Locale;

public enum Role {
    ADMIN("admin"),
    DEVELOPER("developer"),
    FACULTY("faculty"),
    STUDENT("student");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Role fromValue(String raw) {
        if (raw == null) throw new IllegalArgumentException("Role is required");
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(r -> r.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + raw));
    }
}
