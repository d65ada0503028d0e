package com.mind.dashboard.catalog;

import com.mind.dashboard.aggregation.Aggregations;
import com.mind.dashboard.aggregation.Boundary;
import com.mind.dashboard.aggregation.Granularity;
import com.mind.dashboard.catalog.MetricModels.MetricValue;
import com.mind.dashboard.catalog.MetricModels.SeriesPoint;
import com.mind.dashboard.domain.DomainModels.Account;
import com.mind.dashboard.domain.DomainModels.GradeRecord;
import com.mind.dashboard.domain.DomainModels.RecordType;
import com.mind.dashboard.domain.Role;
import com.mind.dashboard.evaluation.LetterGrades;
import com.mind.dashboard.evaluation.StudentAggregate;

import java.util.*;
import java.util.function.Function;

final class GradeMetrics {
    static final int SCORE_DECIMALS = 1;
    static final int RATE_DECIMALS = 2;
    static final double DEFAULT_PASS_MARK = 60.0;

    static final List<Boundary> SCORE_BRACKETS = List.of(
            Boundary.of(0, "0-59"),
            Boundary.of(60, "60-69"),
            Boundary.of(70, "70-79"),
            Boundary.of(80, "80-89"),
            Boundary.of(90, "90+")
    );

    private GradeMetrics() {}

    static List<MetricDefinition> definitions() {
        List<MetricDefinition> out = new ArrayList<>();

        out.add(grade("grades.submission_count", "Submissions")
                .pipeline(ctx -> MetricValue.count(ctx.grades().size(), "submissions")).build());
        out.add(grade("grades.graded_count", "Graded submissions")
                .pipeline(ctx -> MetricValue.count(ctx.grades().stream().filter(GradeRecord::graded).count(), "submissions")).build());
        out.add(grade("grades.pending_count", "Submissions awaiting a grade")
                .pipeline(ctx -> MetricValue.count(ctx.grades().stream().filter(g -> !g.graded()).count(), "submissions")).build());
        out.add(grade("grades.grading_rate", "Share of submissions graded")
                .pipeline(ctx -> MetricValue.number(Aggregations.toPercent(Aggregations.rate(
                        ctx.grades().stream().filter(GradeRecord::graded).count(), ctx.grades().size())), RATE_DECIMALS, "%"))
                .build());

        scoreStatistic(out, "grades.mean_score", "Average score", Aggregations::mean);
        scoreStatistic(out, "grades.median_score", "Median score", v -> Aggregations.percentile(v, 0.5));
        scoreStatistic(out, "grades.min_score", "Lowest score", Aggregations::min);
        scoreStatistic(out, "grades.max_score", "Highest score", Aggregations::max);

        out.add(grade("grades.pass_rate", "Share of graded submissions at or above the pass mark")
                .threshold(DEFAULT_PASS_MARK)
                .pipeline(ctx -> {
                    List<Double> graded = scores(ctx.grades()).stream().filter(Objects::nonNull).toList();
                    long passed = graded.stream().filter(s -> s >= ctx.filters().threshold()).count();
                    return MetricValue.number(Aggregations.toPercent(Aggregations.rate(passed, graded.size())), RATE_DECIMALS, "%");
                })
                .build());

        out.add(grade("grades.letter_distribution", "Letter grade distribution")
                .pipeline(ctx -> distribution(ctx.grades(), LetterGrades.BOUNDARIES, LetterGrades.LETTERS, "letter"))
                .build());
        out.add(grade("grades.bracket_distribution", "Score bracket distribution")
                .pipeline(ctx -> distribution(ctx.grades(), SCORE_BRACKETS,
                        SCORE_BRACKETS.stream().map(Boundary::label).toList(), "bracket"))
                .build());

        out.add(grade("grades.mean_by_student", "Average score by student")
                .pipeline(ctx -> MetricValue.series(byStudent(ctx.grades()).values().stream()
                        .map(s -> SeriesPoint.of(s.studentId(), s.meanScore(), SCORE_DECIMALS))
                        .toList(), "score"))
                .build());
        out.add(grade("grades.mean_by_case_study", "Average score by case study")
                .pipeline(ctx -> {
                    Map<String, String> titles = ctx.caseStudyTitles();
                    return MetricValue.table(new TreeMap<>(Aggregations.groupBy(ctx.grades(), GradeRecord::caseStudyId, rows -> rows))
                            .entrySet().stream()
                            .map(e -> MetricModels.row(
                                    "caseStudy", e.getKey(),
                                    "title", titles.get(e.getKey()),
                                    "submissions", (long) e.getValue().size(),
                                    "graded", Aggregations.countNonNull(scores(e.getValue())),
                                    "meanScore", MetricModels.rounded(Aggregations.mean(scores(e.getValue())), SCORE_DECIMALS)))
                            .toList());
                })
                .build());
        out.add(groupedByAccount("grades.mean_by_department", "Average score by department", "department", Account::department));
        out.add(groupedByAccount("grades.mean_by_cohort", "Average score by cohort", "cohort", Account::cohort));

        out.add(grade("grades.score_trend", "Average score over time")
                .window(TimeWindow.LAST_30_DAYS)
                .granularity(Granularity.DAY)
                .pipeline(ctx -> MetricValue.series(ctx.buckets(ctx.grades(), GradeRecord::submittedAt).entrySet().stream()
                        .map(e -> SeriesPoint.of(ctx.bucketLabel(e.getKey()), Aggregations.mean(scores(e.getValue())), SCORE_DECIMALS))
                        .toList(), "score"))
                .build());
        out.add(grade("grades.rolling_mean", "Rolling average of the per-bucket score")
                .window(TimeWindow.LAST_90_DAYS)
                .granularity(Granularity.DAY)
                .windowSize(7)
                .pipeline(ctx -> {
                    var buckets = ctx.buckets(ctx.grades(), GradeRecord::submittedAt);
                    List<String> keys = buckets.keySet().stream().map(ctx::bucketLabel).toList();
                    List<Double> perBucket = buckets.values().stream()
                            .map(rows -> Aggregations.valueOrNull(Aggregations.mean(scores(rows))))
                            .toList();
                    List<OptionalDouble> rolled = Aggregations.rollingWindow(perBucket, ctx.filters().windowSize(), Aggregations::mean);
                    List<SeriesPoint> points = new ArrayList<>();
                    for (int i = 0; i < keys.size(); i++) {
                        points.add(SeriesPoint.of(keys.get(i), rolled.get(i), SCORE_DECIMALS));
                    }
                    return MetricValue.series(points, "score");
                })
                .build());
        out.add(grade("grades.submission_trend", "Submissions over time")
                .window(TimeWindow.LAST_30_DAYS)
                .granularity(Granularity.DAY)
                .pipeline(ctx -> MetricValue.series(ctx.buckets(ctx.grades(), GradeRecord::submittedAt).entrySet().stream()
                        .map(e -> SeriesPoint.count(ctx.bucketLabel(e.getKey()), e.getValue().size()))
                        .toList(), "submissions"))
                .build());

        out.add(grade("users.active", "Students with at least one submission")
                .window(TimeWindow.LAST_30_DAYS)
                .visibleTo(Role.ADMIN, Role.FACULTY)
                .pipeline(ctx -> MetricValue.count(ctx.grades().stream().map(GradeRecord::ownerId).distinct().count(), "users"))
                .build());
        out.add(grade("users.daily_active", "Students submitting per day")
                .window(TimeWindow.LAST_30_DAYS)
                .visibleTo(Role.ADMIN, Role.FACULTY)
                .granularity(Granularity.DAY)
                .pipeline(ctx -> MetricValue.series(ctx.buckets(ctx.grades(), GradeRecord::submittedAt).entrySet().stream()
                        .map(e -> SeriesPoint.count(ctx.bucketLabel(e.getKey()),
                                e.getValue().stream().map(GradeRecord::ownerId).distinct().count()))
                        .toList(), "users"))
                .build());

        out.addAll(StudentMetrics.definitions());
        return out;
    }

    static MetricDefinition.Builder grade(String id, String label) {
        return MetricDefinition.builder(id, label, RecordType.GRADE);
    }

    static List<Double> scores(Collection<GradeRecord> records) {
        return records.stream().map(GradeRecord::finalScore).toList();
    }

    static TreeMap<String, StudentAggregate> byStudent(Collection<GradeRecord> records) {
        TreeMap<String, StudentAggregate> out = new TreeMap<>();
        Aggregations.groupBy(records, GradeRecord::ownerId, rows -> rows)
                .forEach((owner, rows) -> out.put(owner, StudentAggregate.of(owner, rows)));
        return out;
    }

    private static void scoreStatistic(List<MetricDefinition> out, String id, String label,
                                       Function<List<Double>, OptionalDouble> statistic) {
        out.add(grade(id, label)
                .pipeline(ctx -> MetricValue.number(statistic.apply(scores(ctx.grades())), SCORE_DECIMALS, "score"))
                .build());
    }

    private static MetricValue distribution(List<GradeRecord> records, List<Boundary> boundaries, List<String> order, String column) {
        Map<String, Long> counts = new TreeMap<>();
        for (GradeRecord record : records) {
            Aggregations.histogramBucket(record.finalScore(), boundaries)
                    .ifPresent(label -> counts.merge(label, 1L, Long::sum));
        }
        return MetricValue.table(order.stream()
                .map(label -> MetricModels.row(column, label, "count", counts.getOrDefault(label, 0L)))
                .toList());
    }

    private static MetricDefinition groupedByAccount(String id, String label, String column, Function<Account, String> keyFn) {
        return grade(id, label)
                .visibleTo(Role.ADMIN, Role.FACULTY)
                .pipeline(ctx -> {
                    Map<String, Account> directory = ctx.accountDirectory();
                    Function<GradeRecord, String> groupKey = g -> {
                        Account owner = directory.get(g.ownerId());
                        return AccountMetrics.keyOrUnassigned(owner == null ? null : keyFn.apply(owner));
                    };
                    return MetricValue.table(new TreeMap<>(Aggregations.groupBy(ctx.grades(), groupKey, rows -> rows))
                            .entrySet().stream()
                            .map(e -> MetricModels.row(
                                    column, e.getKey(),
                                    "students", e.getValue().stream().map(GradeRecord::ownerId).distinct().count(),
                                    "submissions", (long) e.getValue().size(),
                                    "meanScore", MetricModels.rounded(Aggregations.mean(scores(e.getValue())), SCORE_DECIMALS)))
                            .toList());
                })
                .build();
    }
}
