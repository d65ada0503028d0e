package com.mind.dashboard.evaluation;

import java.util.function.Predicate;

public enum Badge {
    FIRST_SUBMISSION("First Submission", s -> s.totalSubmissions() >= 1),
    DEDICATED_LEARNER("Dedicated Learner", s -> s.totalSubmissions() >= 10),
    EXPLORER("Explorer", s -> s.distinctCaseStudies() >= 5),
    CONSISTENT_PERFORMER("Consistent Performer",
            s -> s.totalSubmissions() >= 5 && s.meanScore().isPresent() && s.meanScore().getAsDouble() >= 80),
    HIGH_ACHIEVER("High Achiever", s -> s.meanScore().isPresent() && s.meanScore().getAsDouble() >= 90),
    PERFECT_SCORE("Perfect Score", s -> s.maxScore().isPresent() && s.maxScore().getAsDouble() >= 100);

    private final String label;
    private final Predicate<StudentAggregate> rule;

    Badge(String label, Predicate<StudentAggregate> rule) {
        this.label = label;
        this.rule = rule;
    }

    public String label() {
        return label;
    }

    boolean earnedBy(StudentAggregate aggregate) {
        return rule.test(aggregate);
    }
}
