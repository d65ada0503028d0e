package com.mind.dashboard.catalog;

import com.mind.dashboard.aggregation.Aggregations;
import com.mind.dashboard.aggregation.Granularity;
import com.mind.dashboard.catalog.MetricModels.MetricValue;
import com.mind.dashboard.catalog.MetricModels.SeriesPoint;
import com.mind.dashboard.domain.DomainModels.Account;
import com.mind.dashboard.domain.DomainModels.RecordType;
import com.mind.dashboard.domain.Role;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

final class AccountMetrics {
    static final String UNASSIGNED = "unassigned";

    private AccountMetrics() {}

    static List<MetricDefinition> definitions() {
        return List.of(
                MetricDefinition.builder("users.total", "Total users", RecordType.ACCOUNT)
                        .pipeline(ctx -> MetricValue.count(ctx.accounts().size(), "users"))
                        .build(),
                MetricDefinition.builder("users.by_role", "Users by role", RecordType.ACCOUNT)
                        .pipeline(ctx -> {
                            Map<Role, Long> counts = Aggregations.groupBy(ctx.accounts(), Account::role, rows -> (long) rows.size());
                            return MetricValue.series(Arrays.stream(Role.values())
                                    .map(r -> SeriesPoint.count(r.value(), counts.getOrDefault(r, 0L)))
                                    .toList(), "users");
                        })
                        .build(),
                countBy("users.by_department", "Users by department", Account::department),
                countBy("users.by_cohort", "Users by cohort", Account::cohort),
                MetricDefinition.builder("users.registrations_trend", "New registrations over time", RecordType.ACCOUNT)
                        .window(TimeWindow.LAST_30_DAYS)
                        .granularity(Granularity.DAY)
                        .pipeline(ctx -> MetricValue.series(ctx.buckets(ctx.accounts(), Account::registeredAt).entrySet().stream()
                                .map(e -> SeriesPoint.count(ctx.bucketLabel(e.getKey()), e.getValue().size()))
                                .toList(), "users"))
                        .build()
        );
    }

    private static MetricDefinition countBy(String id, String label, Function<Account, String> keyFn) {
        return MetricDefinition.builder(id, label, RecordType.ACCOUNT)
                .pipeline(ctx -> MetricValue.series(
                        Aggregations.groupBy(ctx.accounts(), a -> keyOrUnassigned(keyFn.apply(a)), rows -> (long) rows.size())
                                .entrySet().stream()
                                .sorted(Map.Entry.comparingByKey())
                                .map(e -> SeriesPoint.count(e.getKey(), e.getValue()))
                                .toList(), "users"))
                .build();
    }

    static String keyOrUnassigned(String key) {
        return key == null || key.isBlank() ? UNASSIGNED : key;
    }
}
