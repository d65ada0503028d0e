package com.mind.dashboard.evaluation;

import com.mind.dashboard.aggregation.Aggregations;
import com.mind.dashboard.aggregation.Boundary;

import java.util.List;
import java.util.Optional;

public final class LetterGrades {
    public static final List<Boundary> BOUNDARIES = List.of(
            Boundary.of(90, "A"),
            Boundary.of(80, "B"),
            Boundary.of(70, "C"),
            Boundary.of(60, "D"),
            Boundary.of(0, "F")
    );

    public static final List<String> LETTERS = BOUNDARIES.stream().map(Boundary::label).toList();

    private LetterGrades() {}

    public static Optional<String> letterFor(Double score) {
        return Aggregations.histogramBucket(score, BOUNDARIES);
    }
}
