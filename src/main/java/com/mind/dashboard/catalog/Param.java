package com.mind.dashboard.catalog;

import java.util.Arrays;
import java.util.Optional;

public enum Param {
    WINDOW("window"),
    FROM("from"),
    TO("to"),
    OWNER("owner"),
    DEPARTMENT("department"),
    COHORT("cohort"),
    CASE_STUDY("caseStudy"),
    SERVICE("service"),
    THRESHOLD("threshold"),
    GRANULARITY("granularity"),
    LIMIT("limit"),
    WINDOW_SIZE("windowSize"),
    SLA_MS("slaMs"),
    SEARCH("search");

    private final String key;

    Param(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<Param> fromKey(String key) {
        return Arrays.stream(values()).filter(p -> p.key.equals(key)).findFirst();
    }
}
