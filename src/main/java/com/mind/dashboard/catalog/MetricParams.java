package com.mind.dashboard.catalog;

import com.mind.dashboard.aggregation.Granularity;
import com.mind.dashboard.error.ValidationException;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public record MetricParams(TimeWindow window,
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

    public static final MetricParams NONE = new MetricParams(null, null, null, null, null, null, null, null, null, null, null, null);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_.@:-]{1,64}");
    private static final int MAX_LIMIT = 1000;
    private static final int MAX_WINDOW_SIZE = 365;
    private static final double MAX_SLA_MS = 600_000;
    private static final Pattern SEARCH_TERM = Pattern.compile("[\\p{L}\\p{N} .@_'+-]{1,64}");

    public static MetricParams parse(Map<String, String> raw) {
        if (raw == null || raw.isEmpty()) return NONE;
        raw.keySet().forEach(key -> {
            if (Param.fromKey(key).isEmpty()) {
                throw new ValidationException(key, "Unknown parameter '" + key + "'");
            }
        });
        return new MetricParams(
                TimeWindow.parse(blankToNull(raw.get(Param.WINDOW.key())), blankToNull(raw.get(Param.FROM.key())), blankToNull(raw.get(Param.TO.key()))),
                identifier(raw, Param.OWNER),
                identifier(raw, Param.DEPARTMENT),
                identifier(raw, Param.COHORT),
                identifier(raw, Param.CASE_STUDY),
                identifier(raw, Param.SERVICE),
                number(raw, Param.THRESHOLD, 0, 100),
                granularity(raw),
                integer(raw, Param.LIMIT, 1, MAX_LIMIT),
                integer(raw, Param.WINDOW_SIZE, 1, MAX_WINDOW_SIZE),
                positive(raw, Param.SLA_MS),
                searchTerm(raw)
        );
    }

    public Set<Param> supplied() {
        Set<Param> out = EnumSet.noneOf(Param.class);
        if (window != null) out.add(Param.WINDOW);
        if (owner != null) out.add(Param.OWNER);
        if (department != null) out.add(Param.DEPARTMENT);
        if (cohort != null) out.add(Param.COHORT);
        if (caseStudy != null) out.add(Param.CASE_STUDY);
        if (service != null) out.add(Param.SERVICE);
        if (threshold != null) out.add(Param.THRESHOLD);
        if (granularity != null) out.add(Param.GRANULARITY);
        if (limit != null) out.add(Param.LIMIT);
        if (windowSize != null) out.add(Param.WINDOW_SIZE);
        if (slaMs != null) out.add(Param.SLA_MS);
        if (search != null) out.add(Param.SEARCH);
        return out;
    }

    public MetricParams withOwner(String newOwner) {
        return new MetricParams(window, newOwner, department, cohort, caseStudy, service, threshold, granularity, limit, windowSize, slaMs, search);
    }

    private static String identifier(Map<String, String> raw, Param param) {
        String value = blankToNull(raw.get(param.key()));
        if (value == null) return null;
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new ValidationException(param.key(), "'" + param.key() + "' is not a valid identifier");
        }
        return value;
    }

    private static Double number(Map<String, String> raw, Param param, double min, double max) {
        String value = blankToNull(raw.get(param.key()));
        if (value == null) return null;
        double parsed;
        try {
            parsed = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(param.key(), "'" + param.key() + "' must be a number: " + value);
        }
        if (Double.isNaN(parsed) || parsed < min || parsed > max) {
            throw new ValidationException(param.key(), "'" + param.key() + "' must be within [" + (int) min + "," + (int) max + "]: " + value);
        }
        return parsed;
    }

    private static Double positive(Map<String, String> raw, Param param) {
        Double value = number(raw, param, 0, MAX_SLA_MS);
        if (value != null && value == 0.0) {
            throw new ValidationException(param.key(), "'" + param.key() + "' must be positive");
        }
        return value;
    }

    private static Integer integer(Map<String, String> raw, Param param, int min, int max) {
        String value = blankToNull(raw.get(param.key()));
        if (value == null) return null;
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(param.key(), "'" + param.key() + "' must be an integer: " + value);
        }
        if (parsed < min || parsed > max) {
            throw new ValidationException(param.key(), "'" + param.key() + "' must be within [" + min + "," + max + "]: " + value);
        }
        return parsed;
    }

    private static String searchTerm(Map<String, String> raw) {
        String value = blankToNull(raw.get(Param.SEARCH.key()));
        if (value == null) return null;
        if (!SEARCH_TERM.matcher(value).matches()) {
            throw new ValidationException(Param.SEARCH.key(),
                    "'search' must be at most 64 letters, digits, spaces or . @ _ ' + - characters");
        }
        return value;
    }

    private static Granularity granularity(Map<String, String> raw) {
        String value = blankToNull(raw.get(Param.GRANULARITY.key()));
        if (value == null) return null;
        return Granularity.fromToken(value).orElseThrow(() ->
                new ValidationException(Param.GRANULARITY.key(), "'granularity' must be one of hour, day, week: " + value));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
