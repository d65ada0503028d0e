package com.mind.dashboard.evaluation;

import java.util.Optional;
import java.util.OptionalDouble;

public final class RiskEvaluator {
    private static final double HIGH_MARGIN = 10.0;
    private static final double CRITICAL_MARGIN = 20.0;

    private RiskEvaluator() {}

    public static boolean isAtRisk(OptionalDouble meanScore, double threshold) {
        return meanScore.isPresent() && meanScore.getAsDouble() < threshold;
    }

    public static Optional<RiskTier> tier(OptionalDouble meanScore, double threshold) {
        if (meanScore.isEmpty()) return Optional.empty();
        double mean = meanScore.getAsDouble();
        if (mean < threshold - CRITICAL_MARGIN) return Optional.of(RiskTier.CRITICAL);
        if (mean < threshold - HIGH_MARGIN) return Optional.of(RiskTier.HIGH);
        if (mean < threshold) return Optional.of(RiskTier.MODERATE);
        return Optional.of(RiskTier.ON_TRACK);
    }
}
