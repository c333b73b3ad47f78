package com.costpilot.analytics.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public record AnalysisResult(
        Optional<String> service,
        AnalysisPeriod analysisPeriod,
        Outcome<TrendDecomposition> trendComponents,
        Outcome<SeasonalityReport> seasonality,
        Outcome<TrendMetrics> trendMetrics,
        Outcome<ForecastReport> forecasts,
        List<Anomaly> anomalies,
        List<ChangePoint> changePoints,
        Outcome<VolatilityProfile> volatilityAnalysis,
        Summary summary,
        Instant generatedAt
) {
    public AnalysisResult {
        service = service == null ? Optional.empty() : service;
        anomalies = List.copyOf(anomalies);
        changePoints = List.copyOf(changePoints);
    }

    public record AnalysisPeriod(LocalDate startDate, LocalDate endDate, int daysAnalyzed) {
    }

    /**
     * @param overallTrend empty when trend metrics could not be computed
     */
    public record Summary(
            Optional<TrendDirection> overallTrend,
            double trendStrength,
            double forecastConfidence,
            int anomalyCount,
            boolean seasonalityDetected
    ) {
    }
}
