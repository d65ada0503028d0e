package com.mind.dashboard.catalog;

import com.mind.dashboard.aggregation.Granularity;
import com.mind.dashboard.repository.RecordFilter;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

public record EffectiveFilters(TimeWindow window,
                               String owner,
                               String department,
                               String cohort,
                               String caseStudy,
                               String service,
                               Double threshold,
                               Granularity granularity,
                               Integer limit,
                               Integer windowSize,
                               Double slaMs,
                               String search) {

    public EffectiveFilters {
        if (window == null) throw new IllegalArgumentException("Effective filters need a time window");
    }

    public static EffectiveFilters ofWindow(TimeWindow window) {
        return new EffectiveFilters(window, null, null, null, null, null, null, null, null, null, null, null);
    }

    public RecordFilter recordFilter() {
        return new RecordFilter(owner, department, cohort, caseStudy, service);
    }

    public String canonicalKey() {
        Map<String, String> parts = new TreeMap<>();
        parts.put(Param.WINDOW.key(), window.canonical());
        put(parts, Param.OWNER, owner);
        put(parts, Param.DEPARTMENT, department);
        put(parts, Param.COHORT, cohort);
        put(parts, Param.CASE_STUDY, caseStudy);
        put(parts, Param.SERVICE, service);
        put(parts, Param.THRESHOLD, decimal(threshold));
        put(parts, Param.GRANULARITY, granularity == null ? null : granularity.token());
        put(parts, Param.LIMIT, limit == null ? null : limit.toString());
        put(parts, Param.WINDOW_SIZE, windowSize == null ? null : windowSize.toString());
        put(parts, Param.SLA_MS, decimal(slaMs));
        put(parts, Param.SEARCH, search == null ? null : search.toLowerCase(Locale.ROOT));
        return parts.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
    }

    private static void put(Map<String, String> parts, Param param, String value) {
        if (value != null) parts.put(param.key(), value);
    }

    private static String decimal(Double value) {
        return value == null ? null : BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
