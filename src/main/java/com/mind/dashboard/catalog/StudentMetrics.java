package com.mind.dashboard.catalog;

import com.mind.dashboard.aggregation.Aggregations;
import com.mind.dashboard.catalog.MetricModels.MetricValue;
import com.mind.dashboard.domain.DomainModels.Account;
import com.mind.dashboard.domain.DomainModels.GradeRecord;
import com.mind.dashboard.domain.Role;
import com.mind.dashboard.evaluation.Badge;
import com.mind.dashboard.evaluation.BadgeEvaluator;
import com.mind.dashboard.evaluation.LetterGrades;
import com.mind.dashboard.evaluation.RiskEvaluator;
import com.mind.dashboard.evaluation.RiskTier;
import com.mind.dashboard.evaluation.StudentAggregate;

import java.util.*;

import static com.mind.dashboard.catalog.GradeMetrics.SCORE_DECIMALS;
import static com.mind.dashboard.catalog.GradeMetrics.byStudent;
import static com.mind.dashboard.catalog.GradeMetrics.grade;
import static com.mind.dashboard.catalog.GradeMetrics.scores;

final class StudentMetrics {
    private static final Comparator<StudentAggregate> BY_MEAN_ASC = Comparator
            .comparingDouble((StudentAggregate s) -> s.meanScore().getAsDouble())
            .thenComparing(StudentAggregate::studentId);

    // Students without a graded record sort last.
    private static final Comparator<StudentAggregate> BY_MEAN_DESC = Comparator
            .comparingDouble((StudentAggregate s) -> s.meanScore().isPresent() ? -s.meanScore().getAsDouble() : Double.POSITIVE_INFINITY)
            .thenComparing(StudentAggregate::studentId);

    private StudentMetrics() {}

    static List<MetricDefinition> definitions() {
        return List.of(
                grade("students.at_risk", "Students below the at-risk threshold")
                        .configuredThreshold()
                        .pipeline(ctx -> {
                            double threshold = ctx.filters().threshold();
                            Map<String, Account> directory = ctx.accountDirectory();
                            return MetricValue.table(byStudent(ctx.grades()).values().stream()
                                    .filter(s -> RiskEvaluator.isAtRisk(s.meanScore(), threshold))
                                    .sorted(BY_MEAN_ASC)
                                    .map(s -> MetricModels.row(
                                            "student", s.studentId(),
                                            "name", nameOf(directory, s.studentId()),
                                            "meanScore", MetricModels.rounded(s.meanScore(), SCORE_DECIMALS),
                                            "gradedSubmissions", s.gradedSubmissions(),
                                            "tier", RiskEvaluator.tier(s.meanScore(), threshold).map(Enum::name).orElse(null)))
                                    .toList());
                        })
                        .build(),
                grade("students.performance", "Per-student performance")
                        .search()
                        .pipeline(ctx -> {
                            Map<String, Account> directory = ctx.accountDirectory();
                            Map<String, StudentAggregate> aggregates = byStudent(ctx.grades());
                            Set<String> students = new TreeSet<>(aggregates.keySet());
                            directory.values().stream()
                                    .filter(a -> a.role() == Role.STUDENT)
                                    .forEach(a -> students.add(a.id()));
                            String search = ctx.filters().search();
                            return MetricValue.table(students.stream()
                                    .filter(id -> search == null || matches(directory.get(id), search))
                                    .map(id -> aggregates.getOrDefault(id, StudentAggregate.of(id, List.of())))
                                    .sorted(BY_MEAN_DESC)
                                    .map(s -> {
                                        Account account = directory.get(s.studentId());
                                        return MetricModels.row(
                                                "student", s.studentId(),
                                                "name", account == null ? null : account.name(),
                                                "email", account == null ? null : account.email(),
                                                "submissions", s.totalSubmissions(),
                                                "gradedSubmissions", s.gradedSubmissions(),
                                                "meanScore", MetricModels.rounded(s.meanScore(), SCORE_DECIMALS),
                                                "maxScore", MetricModels.rounded(s.maxScore(), SCORE_DECIMALS),
                                                "letter", s.meanScore().isPresent()
                                                        ? LetterGrades.letterFor(s.meanScore().getAsDouble()).orElse(null) : null);
                                    })
                                    .toList());
                        })
                        .build(),
                grade("students.at_risk_count", "Number of students below the at-risk threshold")
                        .configuredThreshold()
                        .pipeline(ctx -> MetricValue.count(byStudent(ctx.grades()).values().stream()
                                .filter(s -> RiskEvaluator.isAtRisk(s.meanScore(), ctx.filters().threshold()))
                                .count(), "students"))
                        .build(),
                grade("students.risk_tiers", "Students per risk tier")
                        .configuredThreshold()
                        .pipeline(ctx -> {
                            Map<RiskTier, Long> counts = new EnumMap<>(RiskTier.class);
                            byStudent(ctx.grades()).values().forEach(s -> RiskEvaluator.tier(s.meanScore(), ctx.filters().threshold())
                                    .ifPresent(t -> counts.merge(t, 1L, Long::sum)));
                            return MetricValue.table(Arrays.stream(RiskTier.values())
                                    .map(t -> MetricModels.row("tier", t.name(), "students", counts.getOrDefault(t, 0L)))
                                    .toList());
                        })
                        .build(),
                grade("students.top_performers", "Highest average scores")
                        .limit(10)
                        .pipeline(ctx -> {
                            Map<String, Account> directory = ctx.accountDirectory();
                            return MetricValue.table(byStudent(ctx.grades()).values().stream()
                                    .filter(s -> s.meanScore().isPresent())
                                    .sorted(Comparator.comparingDouble((StudentAggregate s) -> s.meanScore().getAsDouble()).reversed()
                                            .thenComparing(StudentAggregate::studentId))
                                    .limit(ctx.filters().limit())
                                    .map(s -> MetricModels.row(
                                            "student", s.studentId(),
                                            "name", nameOf(directory, s.studentId()),
                                            "meanScore", MetricModels.rounded(s.meanScore(), SCORE_DECIMALS),
                                            "letter", LetterGrades.letterFor(s.meanScore().getAsDouble()).orElse(null),
                                            "gradedSubmissions", s.gradedSubmissions()))
                                    .toList());
                        })
                        .build(),
                grade("students.letter_grade", "Letter grade of the average score")
                        .pipeline(ctx -> {
                            OptionalDouble mean = Aggregations.mean(scores(ctx.grades()));
                            if (mean.isEmpty()) return MetricValue.undefined();
                            return MetricValue.label(LetterGrades.letterFor(mean.getAsDouble()).orElse(null));
                        })
                        .build(),
                grade("students.badges", "Achievement badges")
                        .pipeline(ctx -> MetricValue.table(byStudent(ctx.grades()).values().stream()
                                .map(s -> MetricModels.row(
                                        "student", s.studentId(),
                                        "badges", BadgeEvaluator.evaluate(s).stream().map(Badge::name).toList(),
                                        "distinctCaseStudies", s.distinctCaseStudies(),
                                        "totalSubmissions", s.totalSubmissions(),
                                        "meanScore", MetricModels.rounded(s.meanScore(), SCORE_DECIMALS),
                                        "maxScore", MetricModels.rounded(s.maxScore(), SCORE_DECIMALS)))
                                .toList()))
                        .build(),
                grade("students.progress", "Case studies attempted per student")
                        .pipeline(ctx -> {
                            int catalogSize = ctx.caseStudyTitles().size();
                            return MetricValue.table(byStudent(ctx.grades()).values().stream()
                                    .map(s -> MetricModels.row(
                                            "student", s.studentId(),
                                            "caseStudiesAttempted", s.distinctCaseStudies(),
                                            "caseStudiesAvailable", (long) catalogSize,
                                            "completionPercent", MetricModels.rounded(Aggregations.toPercent(
                                                    Aggregations.rate(s.distinctCaseStudies(), catalogSize)), GradeMetrics.RATE_DECIMALS)))
                                    .toList());
                        })
                        .build(),
                grade("case_studies.participation", "Participation by case study")
                        .pipeline(ctx -> {
                            Map<String, String> titles = ctx.caseStudyTitles();
                            return MetricValue.table(new TreeMap<>(Aggregations.groupBy(ctx.grades(), GradeRecord::caseStudyId, rows -> rows))
                                    .entrySet().stream()
                                    .map(e -> MetricModels.row(
                                            "caseStudy", e.getKey(),
                                            "title", titles.get(e.getKey()),
                                            "students", e.getValue().stream().map(GradeRecord::ownerId).distinct().count(),
                                            "submissions", (long) e.getValue().size()))
                                    .toList());
                        })
                        .build()
        );
    }

    private static boolean matches(Account account, String search) {
        if (account == null) return false;
        String needle = search.toLowerCase(Locale.ROOT);
        return contains(account.name(), needle) || contains(account.email(), needle);
    }

    private static boolean contains(String field, String needle) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String nameOf(Map<String, Account> directory, String studentId) {
        Account account = directory.get(studentId);
        return account == null ? null : account.name();
    }
}
