package com.costpilot.analytics.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record RecommendationSet(
        int totalRecommendations,
        double totalEstimatedSavings,
        List<Recommendation> recommendations,
        Map<Recommendation.Priority, Integer> priorityDistribution,
        AnalysisSummary analysisSummary,
        Instant generatedAt
) {
    public RecommendationSet {
        recommendations = List.copyOf(recommendations);
        priorityDistribution = Collections.unmodifiableMap(new EnumMap<>(priorityDistribution));
    }

    public record AnalysisSummary(
            Optional<TrendDirection> trendDirection,
            Optional<VolatilityProfile.Level> volatilityLevel,
            int anomalyCount,
            double forecastConfidence
    ) {
    }
}
