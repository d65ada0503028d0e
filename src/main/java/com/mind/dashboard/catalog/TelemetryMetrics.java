package com.mind.dashboard.catalog;

import com.mind.dashboard.aggregation.Aggregations;
import com.mind.dashboard.aggregation.Boundary;
import com.mind.dashboard.aggregation.Granularity;
import com.mind.dashboard.catalog.MetricModels.MetricValue;
import com.mind.dashboard.catalog.MetricModels.SeriesPoint;
import com.mind.dashboard.domain.DomainModels.RecordType;
import com.mind.dashboard.domain.DomainModels.TelemetryEvent;

import java.util.*;
import java.util.function.Function;

final class TelemetryMetrics {
    static final int LATENCY_DECIMALS = 1;
    static final int RATE_DECIMALS = 2;
    static final double USD_PER_MILLION_TOKENS = 15.0;

    static final List<Boundary> STATUS_CLASSES = List.of(
            Boundary.of(0, "other"),
            Boundary.of(100, "1xx"),
            Boundary.of(200, "2xx"),
            Boundary.of(300, "3xx"),
            Boundary.of(400, "4xx"),
            Boundary.of(500, "5xx")
    );

    static final List<Boundary> LATENCY_BANDS = List.of(
            Boundary.of(0, "<100ms"),
            Boundary.of(100, "100-249ms"),
            Boundary.of(250, "250-499ms"),
            Boundary.of(500, "500-999ms"),
            Boundary.of(1000, ">=1000ms")
    );

    private static final Map<String, Double> LATENCY_PERCENTILES = Map.of(
            "telemetry.latency_p50", 0.50,
            "telemetry.latency_p95", 0.95,
            "telemetry.latency_p99", 0.99
    );

    private static final Comparator<RouteStats> SLOWEST_FIRST = Comparator
            .comparingDouble((RouteStats r) -> r.p95Latency().orElse(Double.NEGATIVE_INFINITY)).reversed()
            .thenComparing(RouteStats::route);

    private TelemetryMetrics() {}

    static List<MetricDefinition> definitions() {
        List<MetricDefinition> out = new ArrayList<>();

        out.add(telemetry("telemetry.request_count", "Requests")
                .pipeline(ctx -> MetricValue.count(ctx.telemetry().size(), "requests")).build());
        out.add(telemetry("telemetry.error_count", "Failed requests")
                .pipeline(ctx -> MetricValue.count(errors(ctx.telemetry()), "requests")).build());
        out.add(telemetry("telemetry.error_rate", "Error rate")
                .pipeline(ctx -> MetricValue.number(errorPercent(ctx.telemetry()), RATE_DECIMALS, "%")).build());
        // Approximated as 1 - error rate; this is not measured availability.
        out.add(telemetry("telemetry.uptime", "Uptime (1 - error rate)")
                .pipeline(ctx -> {
                    OptionalDouble errorPercent = errorPercent(ctx.telemetry());
                    return MetricValue.number(errorPercent.isPresent() ? OptionalDouble.of(100.0 - errorPercent.getAsDouble()) : errorPercent,
                            RATE_DECIMALS, "%");
                })
                .build());

        out.add(latencyStatistic("telemetry.latency_mean", "Average latency", Aggregations::mean));
        new TreeMap<>(LATENCY_PERCENTILES).forEach((id, p) ->
                out.add(latencyStatistic(id, "P" + Math.round(p * 100) + " latency", v -> Aggregations.percentile(v, p))));
        out.add(latencyStatistic("telemetry.latency_max", "Slowest request", Aggregations::max));

        out.add(telemetry("telemetry.latency_by_route", "Latency by route")
                .limit(10)
                .pipeline(ctx -> MetricValue.table(routeStats(ctx.telemetry()).stream()
                        .sorted(SLOWEST_FIRST)
                        .limit(ctx.filters().limit())
                        .map(r -> MetricModels.row(
                                "route", r.route(),
                                "requests", r.requests(),
                                "meanLatencyMs", MetricModels.rounded(r.meanLatency(), LATENCY_DECIMALS),
                                "p95LatencyMs", MetricModels.rounded(r.p95Latency(), LATENCY_DECIMALS)))
                        .toList()))
                .build());
        out.add(telemetry("telemetry.requests_by_service", "Requests by service")
                .pipeline(ctx -> MetricValue.series(countsByKey(ctx.telemetry(), TelemetryEvent::serviceName), "requests"))
                .build());
        out.add(telemetry("telemetry.errors_by_route", "Errors by route")
                .limit(10)
                .pipeline(ctx -> MetricValue.table(routeStats(ctx.telemetry()).stream()
                        .filter(r -> r.errors() > 0)
                        .sorted(Comparator.comparingLong(RouteStats::errors).reversed().thenComparing(RouteStats::route))
                        .limit(ctx.filters().limit())
                        .map(r -> MetricModels.row(
                                "route", r.route(),
                                "requests", r.requests(),
                                "errors", r.errors(),
                                "errorRatePercent", MetricModels.rounded(
                                        Aggregations.toPercent(Aggregations.rate(r.errors(), r.requests())), RATE_DECIMALS)))
                        .toList()))
                .build());
        out.add(telemetry("telemetry.status_distribution", "Requests by status class")
                .pipeline(ctx -> distribution(ctx.telemetry(), e -> (double) e.statusCode(), STATUS_CLASSES))
                .build());
        out.add(telemetry("telemetry.latency_distribution", "Requests by latency band")
                .pipeline(ctx -> distribution(ctx.telemetry(), TelemetryEvent::latencyMs, LATENCY_BANDS))
                .build());

        out.add(trend("telemetry.request_trend", "Requests over time", "requests",
                rows -> OptionalDouble.of(rows.size()), 0));
        out.add(trend("telemetry.error_rate_trend", "Error rate over time", "%",
                TelemetryMetrics::errorPercent, RATE_DECIMALS));
        out.add(trend("telemetry.latency_p95_trend", "P95 latency over time", "ms",
                rows -> Aggregations.percentile(latencies(rows), 0.95), LATENCY_DECIMALS));
        out.add(telemetry("telemetry.rolling_error_rate", "Rolling error rate")
                .granularity(Granularity.HOUR)
                .windowSize(24)
                .pipeline(ctx -> {
                    var buckets = ctx.buckets(ctx.telemetry(), TelemetryEvent::timestamp);
                    List<String> keys = buckets.keySet().stream().map(ctx::bucketLabel).toList();
                    List<Double> requests = buckets.values().stream().map(rows -> (double) rows.size()).toList();
                    List<Double> failed = buckets.values().stream().map(rows -> (double) errors(rows)).toList();
                    int size = ctx.filters().windowSize();
                    List<OptionalDouble> requestSums = Aggregations.rollingWindow(requests, size, Aggregations::sum);
                    List<OptionalDouble> errorSums = Aggregations.rollingWindow(failed, size, Aggregations::sum);
                    List<SeriesPoint> points = new ArrayList<>();
                    for (int i = 0; i < keys.size(); i++) {
                        OptionalDouble rate = Aggregations.rate(
                                (long) errorSums.get(i).orElse(0), (long) requestSums.get(i).orElse(0));
                        points.add(SeriesPoint.of(keys.get(i), Aggregations.toPercent(rate), RATE_DECIMALS));
                    }
                    return MetricValue.series(points, "%");
                })
                .build());

        out.add(telemetry("telemetry.sla_breaches", "Routes whose P95 latency exceeds the SLA")
                .slaMs(1000)
                .pipeline(ctx -> {
                    double sla = ctx.filters().slaMs();
                    return MetricValue.table(routeStats(ctx.telemetry()).stream()
                            .filter(r -> r.p95Latency().isPresent() && r.p95Latency().getAsDouble() > sla)
                            .sorted(SLOWEST_FIRST)
                            .map(r -> MetricModels.row(
                                    "route", r.route(),
                                    "requests", r.requests(),
                                    "p95LatencyMs", MetricModels.rounded(r.p95Latency(), LATENCY_DECIMALS),
                                    "slaMs", sla))
                            .toList());
                })
                .build());
        out.add(telemetry("telemetry.recent_errors", "Most recent failed requests")
                .limit(50)
                .pipeline(ctx -> MetricValue.table(ctx.telemetry().stream()
                        .filter(TelemetryEvent::error)
                        .sorted(Comparator.comparing(TelemetryEvent::timestamp).reversed().thenComparing(TelemetryEvent::id))
                        .limit(ctx.filters().limit())
                        .map(e -> MetricModels.row(
                                "timestamp", e.timestamp().toString(),
                                "service", e.serviceName(),
                                "route", e.route(),
                                "statusCode", e.statusCode(),
                                "latencyMs", e.latencyMs()))
                        .toList()))
                .build());

        out.addAll(aiDefinitions());
        return out;
    }

    private static List<MetricDefinition> aiDefinitions() {
        return List.of(
                telemetry("ai.total_tokens", "AI tokens consumed")
                        .pipeline(ctx -> MetricValue.number(Aggregations.sum(tokens(ctx.telemetry())), 0, "tokens"))
                        .build(),
                telemetry("ai.tokens_per_request", "Average tokens per AI request")
                        .pipeline(ctx -> MetricValue.number(Aggregations.mean(tokens(aiRequests(ctx.telemetry()))), 1, "tokens"))
                        .build(),
                telemetry("ai.requests_by_model", "AI requests by model")
                        .pipeline(ctx -> MetricValue.series(countsByKey(aiRequests(ctx.telemetry()), TelemetryEvent::aiModel), "requests"))
                        .build(),
                telemetry("ai.tokens_by_model", "AI tokens by model")
                        .pipeline(ctx -> MetricValue.series(new TreeMap<>(Aggregations.groupBy(aiRequests(ctx.telemetry()), TelemetryEvent::aiModel,
                                        rows -> Aggregations.sum(tokens(rows))))
                                .entrySet().stream()
                                .map(e -> SeriesPoint.of(e.getKey(), e.getValue(), 0))
                                .toList(), "tokens"))
                        .build(),
                telemetry("ai.estimated_cost", "Estimated AI spend")
                        .pipeline(ctx -> {
                            OptionalDouble total = Aggregations.sum(tokens(ctx.telemetry()));
                            return MetricValue.number(total.isPresent()
                                    ? OptionalDouble.of(total.getAsDouble() / 1_000_000 * USD_PER_MILLION_TOKENS)
                                    : total, 2, "USD");
                        })
                        .build(),
                trend("ai.token_trend", "AI tokens over time", "tokens",
                        rows -> Aggregations.sum(tokens(rows)), 0)
        );
    }

    static MetricDefinition.Builder telemetry(String id, String label) {
        return MetricDefinition.builder(id, label, RecordType.TELEMETRY).window(TimeWindow.LAST_7_DAYS);
    }

    private static MetricDefinition latencyStatistic(String id, String label, Function<List<Double>, OptionalDouble> statistic) {
        return telemetry(id, label)
                .pipeline(ctx -> MetricValue.number(statistic.apply(latencies(ctx.telemetry())), LATENCY_DECIMALS, "ms"))
                .build();
    }

    private static MetricDefinition trend(String id, String label, String unit,
                                          Function<List<TelemetryEvent>, OptionalDouble> perBucket, int decimals) {
        return telemetry(id, label)
                .granularity(Granularity.HOUR)
                .pipeline(ctx -> MetricValue.series(ctx.buckets(ctx.telemetry(), TelemetryEvent::timestamp).entrySet().stream()
                        .map(e -> SeriesPoint.of(ctx.bucketLabel(e.getKey()), perBucket.apply(e.getValue()), decimals))
                        .toList(), unit))
                .build();
    }

    private static MetricValue distribution(List<TelemetryEvent> events, Function<TelemetryEvent, Double> valueFn, List<Boundary> bands) {
        Map<String, Long> counts = new TreeMap<>();
        for (TelemetryEvent e : events) {
            Aggregations.histogramBucket(valueFn.apply(e), bands).ifPresent(label -> counts.merge(label, 1L, Long::sum));
        }
        return MetricValue.series(bands.stream()
                .map(b -> SeriesPoint.count(b.label(), counts.getOrDefault(b.label(), 0L)))
                .toList(), "requests");
    }

    private static List<SeriesPoint> countsByKey(List<TelemetryEvent> events, Function<TelemetryEvent, String> keyFn) {
        return new TreeMap<>(Aggregations.groupBy(events, e -> AccountMetrics.keyOrUnassigned(keyFn.apply(e)), rows -> (long) rows.size()))
                .entrySet().stream()
                .map(e -> SeriesPoint.count(e.getKey(), e.getValue()))
                .toList();
    }

    static long errors(Collection<TelemetryEvent> events) {
        return events.stream().filter(TelemetryEvent::error).count();
    }

    static OptionalDouble errorPercent(Collection<TelemetryEvent> events) {
        return Aggregations.toPercent(Aggregations.rate(errors(events), events.size()));
    }

    static List<Double> latencies(Collection<TelemetryEvent> events) {
        return events.stream().map(TelemetryEvent::latencyMs).toList();
    }

    private static List<Long> tokens(Collection<TelemetryEvent> events) {
        return events.stream().map(TelemetryEvent::aiTokens).toList();
    }

    private static List<TelemetryEvent> aiRequests(Collection<TelemetryEvent> events) {
        return events.stream().filter(e -> e.aiModel() != null).toList();
    }

    private static List<RouteStats> routeStats(List<TelemetryEvent> events) {
        return Aggregations.groupBy(events, TelemetryEvent::route, rows -> rows).entrySet().stream()
                .map(e -> new RouteStats(
                        e.getKey(),
                        e.getValue().size(),
                        errors(e.getValue()),
                        Aggregations.mean(latencies(e.getValue())),
                        Aggregations.percentile(latencies(e.getValue()), 0.95)))
                .toList();
    }

    private record RouteStats(String route, long requests, long errors, OptionalDouble meanLatency, OptionalDouble p95Latency) {}
}
