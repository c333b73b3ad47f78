package com.costpilot.analytics.analytics;

import com.costpilot.analytics.config.CostPilotProperties;
import com.costpilot.analytics.model.AnalysisResult;
import com.costpilot.analytics.model.Anomaly;
import com.costpilot.analytics.model.EnsembleForecast;
import com.costpilot.analytics.model.ForecastReport;
import com.costpilot.analytics.model.Recommendation;
import com.costpilot.analytics.model.RecommendationSet;
import com.costpilot.analytics.model.TrendDirection;
import com.costpilot.analytics.model.TrendMetrics;
import com.costpilot.analytics.model.VolatilityProfile;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns an {@link AnalysisResult} into prioritized optimization actions. A rule whose input section
 * is unavailable is skipped.
 */
@Component
public class RecommendationGenerator {

    private static final double VOLATILITY_SAVINGS_RATE = 0.15d;
    private static final double GROWTH_SAVINGS_RATE = 0.25d;
    private static final double ANOMALY_SAVINGS_RATE = 0.5d;
    private static final double GROWTH_THRESHOLD_PCT = 20d;
    private static final int HIGH_SEVERITY = 4;
    private static final int ANOMALY_COUNT_THRESHOLD = 3;
    private static final double BUDGET_OVERRUN_FACTOR = 1.2d;
    private static final int DAYS_PER_MONTH = 30;

    private final int maxReturned;
    private final Clock clock;

    @Autowired
    public RecommendationGenerator(CostPilotProperties properties) {
        this(properties, Clock.systemUTC());
    }

    RecommendationGenerator(CostPilotProperties properties, Clock clock) {
        this.maxReturned = properties.recommendations().maxReturned();
        this.clock = clock;
    }

    public RecommendationSet generate(AnalysisResult analysis) {
        Optional<TrendMetrics> trend = analysis.trendMetrics().asOptional();
        Optional<VolatilityProfile> volatility = analysis.volatilityAnalysis().asOptional();
        Optional<ForecastReport> forecasts = analysis.forecasts().asOptional();

        List<Recommendation> generated = new ArrayList<>();
        volatilityManagement(volatility, trend).ifPresent(generated::add);
        trend.flatMap(this::growthControl).ifPresent(generated::add);
        anomalyPrevention(analysis.anomalies()).ifPresent(generated::add);
        trend.flatMap(metrics -> forecasts
                        .flatMap(report -> report.ensemble().asOptional())
                        .flatMap(ensemble -> budgetPlanning(metrics, ensemble)))
                .ifPresent(generated::add);
        generated.addAll(ServiceOptimizationCatalog.hintsFor(analysis.service()));

        Map<Recommendation.Priority, Integer> distribution = new EnumMap<>(Recommendation.Priority.class);
        for (Recommendation.Priority priority : Recommendation.Priority.values()) {
            distribution.put(priority, 0);
        }
        generated.forEach(recommendation -> distribution.merge(recommendation.priority(), 1, Integer::sum));
        double totalSavings = generated.stream().mapToDouble(Recommendation::estimatedSavings).sum();

        List<Recommendation> ranked = generated.stream()
                .sorted(Comparator.comparing(Recommendation::priority)
                        .thenComparing(Comparator.comparingDouble(Recommendation::estimatedSavings).reversed()))
                .limit(maxReturned)
                .toList();

        return new RecommendationSet(
                generated.size(),
                totalSavings,
                ranked,
                distribution,
                new RecommendationSet.AnalysisSummary(
                        trend.map(TrendMetrics::direction),
                        volatility.map(VolatilityProfile::level),
                        analysis.anomalies().size(),
                        forecasts.map(ForecastReport::confidence).orElse(0d)
                ),
                Instant.now(clock)
        );
    }

    private Optional<Recommendation> volatilityManagement(Optional<VolatilityProfile> volatility, Optional<TrendMetrics> trend) {
        if (volatility.isEmpty()) {
            return Optional.empty();
        }
        VolatilityProfile profile = volatility.get();
        if (profile.level() != VolatilityProfile.Level.HIGH && profile.level() != VolatilityProfile.Level.VERY_HIGH) {
            return Optional.empty();
        }
        double averageCost = trend.map(TrendMetrics::averageCost).orElse(0d);
        return Optional.of(new Recommendation(
                Recommendation.Type.VOLATILITY_MANAGEMENT,
                Recommendation.Priority.HIGH,
                "Implement Cost Smoothing Strategies",
                String.format(Locale.ROOT, "Cost volatility is %s (CV: %.2f)",
                        profile.level().name().toLowerCase(Locale.ROOT), profile.coefficientOfVariation()),
                List.of(
                        "Implement request batching to reduce transaction frequency",
                        "Use cost averaging strategies for API calls",
                        "Set up automated alerts for cost spikes",
                        "Consider reserved pricing for predictable workloads"
                ),
                averageCost * VOLATILITY_SAVINGS_RATE,
                "Reduce cost unpredictability and enable better budgeting",
                Optional.empty()
        ));
    }

    private Optional<Recommendation> growthControl(TrendMetrics metrics) {
        if (metrics.direction() != TrendDirection.INCREASING || metrics.percentageChange() <= GROWTH_THRESHOLD_PCT) {
            return Optional.empty();
        }
        return Optional.of(new Recommendation(
                Recommendation.Type.GROWTH_CONTROL,
                Recommendation.Priority.HIGH,
                "Control Rapid Cost Growth",
                String.format(Locale.ROOT, "Costs are increasing at %.1f%% rate", metrics.percentageChange()),
                List.of(
                        "Review and optimize high-frequency API calls",
                        "Implement rate limiting and throttling",
                        "Analyze cost per transaction efficiency",
                        "Consider alternative service providers or pricing tiers"
                ),
                metrics.totalCost() * GROWTH_SAVINGS_RATE,
                "Prevent budget overruns and improve cost efficiency",
                Optional.empty()
        ));
    }

    private Optional<Recommendation> anomalyPrevention(List<Anomaly> anomalies) {
        List<Anomaly> severe = anomalies.stream()
                .filter(anomaly -> anomaly.severity() >= HIGH_SEVERITY)
                .toList();
        if (severe.size() <= ANOMALY_COUNT_THRESHOLD) {
            return Optional.empty();
        }
        double severeCost = severe.stream().mapToDouble(Anomaly::cost).sum();
        return Optional.of(new Recommendation(
                Recommendation.Type.ANOMALY_PREVENTION,
                Recommendation.Priority.MEDIUM,
                "Prevent Cost Anomalies",
                "Detected " + severe.size() + " high-severity cost anomalies",
                List.of(
                        "Implement real-time cost monitoring and alerts",
                        "Set up automatic circuit breakers for high-cost operations",
                        "Review unusual usage patterns on anomaly dates",
                        "Implement pre-approval workflows for high-cost operations"
                ),
                severeCost * ANOMALY_SAVINGS_RATE,
                "Prevent unexpected cost spikes and improve predictability",
                Optional.empty()
        ));
    }

    private Optional<Recommendation> budgetPlanning(TrendMetrics metrics, EnsembleForecast ensemble) {
        double projected = ensemble.total();
        double currentMonthly = metrics.averageCost() * DAYS_PER_MONTH;
        if (currentMonthly <= 0 || projected <= currentMonthly * BUDGET_OVERRUN_FACTOR) {
            return Optional.empty();
        }
        return Optional.of(new Recommendation(
                Recommendation.Type.BUDGET_PLANNING,
                Recommendation.Priority.MEDIUM,
                "Adjust Budget Planning",
                String.format(Locale.ROOT, "Forecast shows %.1f%% cost increase", (projected / currentMonthly - 1) * 100),
                List.of(
                        "Increase monthly budget allocation",
                        "Negotiate better pricing with service providers",
                        "Implement cost caps and automatic scaling limits",
                        "Plan for seasonal cost variations"
                ),
                0d,
                "Prevent budget shortfalls and enable proactive cost management",
                Optional.empty()
        ));
    }
}
