package com.mind.dashboard.evaluation;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

public final class BadgeEvaluator {

    private BadgeEvaluator() {}

    public static Set<Badge> evaluate(StudentAggregate aggregate) {
        return Arrays.stream(Badge.values())
                .filter(b -> b.earnedBy(aggregate))
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Badge.class)));
    }
}
