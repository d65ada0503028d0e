package com.mind.dashboard.evaluation;

public enum RiskTier {
    CRITICAL,
    HIGH,
    MODERATE,
    ON_TRACK;

    public boolean atRisk() {
        return this != ON_TRACK;
    }
}
