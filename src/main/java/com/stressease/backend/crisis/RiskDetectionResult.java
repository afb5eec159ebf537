package com.stressease.backend.crisis;

public record RiskDetectionResult(boolean risk, RiskCategory category) {

    private static final RiskDetectionResult NO_RISK = new RiskDetectionResult(false, RiskCategory.NONE);

    public static RiskDetectionResult none() {
        return NO_RISK;
    }

    public static RiskDetectionResult of(RiskCategory category) {
        return category == RiskCategory.NONE ? NO_RISK : new RiskDetectionResult(true, category);
    }
}
