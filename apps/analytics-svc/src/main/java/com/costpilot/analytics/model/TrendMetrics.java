package com.costpilot.analytics.model;

public record TrendMetrics(
        TrendDirection direction,
        double strength,
        double correlation,
        double totalCost,
        double averageCost,
        double minCost,
        double maxCost,
        double dailyChangeRate,
        double percentageChange,
        double volatility,
        double coefficientOfVariation,
        double acceleration,
        double recentVsHistoricalPct,
        int dataPoints,
        long timeSpanDays
) {
}
