package com.mind.dashboard.evaluation;

import com.mind.dashboard.aggregation.Aggregations;
import com.mind.dashboard.domain.DomainModels.GradeRecord;

import java.util.Collection;
import java.util.Objects;
import java.util.OptionalDouble;

public record StudentAggregate(String studentId,
                               long distinctCaseStudies,
                               long totalSubmissions,
                               long gradedSubmissions,
                               OptionalDouble meanScore,
                               OptionalDouble maxScore) {

    public static StudentAggregate of(String studentId, Collection<GradeRecord> records) {
        var scores = records.stream().map(GradeRecord::finalScore).toList();
        return new StudentAggregate(
                studentId,
                records.stream().map(GradeRecord::caseStudyId).filter(Objects::nonNull).distinct().count(),
                records.size(),
                Aggregations.countNonNull(scores),
                Aggregations.mean(scores),
                Aggregations.max(scores)
        );
    }
}
