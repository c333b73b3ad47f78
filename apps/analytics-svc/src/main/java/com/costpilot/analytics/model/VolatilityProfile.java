package com.costpilot.analytics.model;

import java.util.List;

public record VolatilityProfile(
        double stdDev,
        double coefficientOfVariation,
        Level level,
        List<Double> rollingVolatilities,
        double averageRollingVolatility,
        double volatilityTrend,
        TrendDescription trendDescription,
        int highVolatilityPeriods,
        int totalPeriods,
        double minCost,
        double maxCost,
        double costRange
) {
    public VolatilityProfile {
        rollingVolatilities = List.copyOf(rollingVolatilities);
    }

    public enum Level {
        LOW,
        MODERATE,
        HIGH,
        VERY_HIGH
    }

    public enum TrendDescription {
        INCREASING,
        DECREASING,
        STABLE,
        UNKNOWN
    }
}
