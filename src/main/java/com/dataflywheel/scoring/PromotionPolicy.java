package com.dataflywheel.scoring;

public record PromotionPolicy(double tolerance) {

    public PromotionPolicy {
        if (tolerance < 0.0 || Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("promotion tolerance must be >= 0");
        }
    }

    public boolean isPromotable(double bestScore, double baselineScore) {
        return bestScore >= baselineScore - tolerance;
    }
}
