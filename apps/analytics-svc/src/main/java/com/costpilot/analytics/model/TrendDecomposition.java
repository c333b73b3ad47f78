package com.costpilot.analytics.model;

import java.util.List;

public record TrendDecomposition(
        List<Double> trend,
        List<Double> seasonal,
        List<Double> residuals,
        VarianceExplained varianceExplained,
        double quality
) {
    public TrendDecomposition {
        trend = List.copyOf(trend);
        seasonal = List.copyOf(seasonal);
        residuals = List.copyOf(residuals);
        if (trend.size() != seasonal.size() || trend.size() != residuals.size()) {
            throw new IllegalArgumentException("components must be index-aligned");
        }
    }

    public record VarianceExplained(double trendPct, double seasonalPct, double residualPct) {
        public static VarianceExplained none() {
            return new VarianceExplained(0, 0, 0);
        }
    }
}
