package com.mind.dashboard.aggregation;

public record Boundary(double lower, String label) {
    public static Boundary of(double lower, String label) {
        return new Boundary(lower, label);
    }
}
