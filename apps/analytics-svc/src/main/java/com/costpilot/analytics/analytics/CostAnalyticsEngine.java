package com.costpilot.analytics.analytics;

import com.costpilot.analytics.analytics.forecast.ForecastEnsemble;
import com.costpilot.analytics.config.CostPilotProperties;
import com.costpilot.analytics.exception.InsufficientDataException;
import com.costpilot.analytics.exception.UpstreamFailureException;
import com.costpilot.analytics.model.AnalysisResult;
import com.costpilot.analytics.model.Anomaly;
import com.costpilot.analytics.model.ChangePoint;
import com.costpilot.analytics.model.CostPoint;
import com.costpilot.analytics.model.CostSeries;
import com.costpilot.analytics.model.ForecastReport;
import com.costpilot.analytics.model.Outcome;
import com.costpilot.analytics.model.RecommendationSet;
import com.costpilot.analytics.model.SeasonalityReport;
import com.costpilot.analytics.model.TrendDecomposition;
import com.costpilot.analytics.model.TrendMetrics;
import com.costpilot.analytics.model.VolatilityProfile;
import com.costpilot.analytics.repository.DailyCostLoader;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Entry point of the cost analytics pipeline: loads a daily series, runs every analysis over it
 * and assembles the result. Individual sections that cannot be computed are reported as
 * unavailable; only a series too short for any analysis fails the call.
 */
@Service
public class CostAnalyticsEngine {

    private static final Logger log = LoggerFactory.getLogger(CostAnalyticsEngine.class);

    public static final int MINIMUM_POINTS = 7;

    private final DailyCostLoader loader;
    private final CostPilotProperties properties;
    private final TrendDecomposer trendDecomposer;
    private final SeasonalityDetector seasonalityDetector;
    private final TrendMetricsCalculator trendMetricsCalculator;
    private final ForecastEnsemble forecastEnsemble;
    private final AnomalyDetector anomalyDetector;
    private final ChangePointDetector changePointDetector;
    private final VolatilityAnalyzer volatilityAnalyzer;
    private final RecommendationGenerator recommendationGenerator;
    private final Clock clock;

    @Autowired
    public CostAnalyticsEngine(DailyCostLoader loader,
                               CostPilotProperties properties,
                               TrendDecomposer trendDecomposer,
                               SeasonalityDetector seasonalityDetector,
                               TrendMetricsCalculator trendMetricsCalculator,
                               ForecastEnsemble forecastEnsemble,
                               AnomalyDetector anomalyDetector,
                               ChangePointDetector changePointDetector,
                               VolatilityAnalyzer volatilityAnalyzer,
                               RecommendationGenerator recommendationGenerator) {
        this(loader, properties, trendDecomposer, seasonalityDetector, trendMetricsCalculator, forecastEnsemble,
                anomalyDetector, changePointDetector, volatilityAnalyzer, recommendationGenerator, Clock.systemUTC());
    }

    CostAnalyticsEngine(DailyCostLoader loader,
                        CostPilotProperties properties,
                        TrendDecomposer trendDecomposer,
                        SeasonalityDetector seasonalityDetector,
                        TrendMetricsCalculator trendMetricsCalculator,
                        ForecastEnsemble forecastEnsemble,
                        AnomalyDetector anomalyDetector,
                        ChangePointDetector changePointDetector,
                        VolatilityAnalyzer volatilityAnalyzer,
                        RecommendationGenerator recommendationGenerator,
                        Clock clock) {
        this.loader = loader;
        this.properties = properties;
        this.trendDecomposer = trendDecomposer;
        this.seasonalityDetector = seasonalityDetector;
        this.trendMetricsCalculator = trendMetricsCalculator;
        this.forecastEnsemble = forecastEnsemble;
        this.anomalyDetector = anomalyDetector;
        this.changePointDetector = changePointDetector;
        this.volatilityAnalyzer = volatilityAnalyzer;
        this.recommendationGenerator = recommendationGenerator;
        this.clock = clock;
    }

    public AnalysisResult analyzeTrends(Optional<String> service) {
        CostPilotProperties.Analysis defaults = properties.analysis();
        return analyzeTrends(service, defaults.defaultDaysBack(), defaults.defaultForecastDays());
    }

    public AnalysisResult analyzeTrends(Optional<String> service, int daysBack, int forecastDays) {
        if (daysBack <= 0) {
            throw new IllegalArgumentException("daysBack must be positive");
        }
        requirePositiveForecastDays(forecastDays);
        Optional<String> filter = service == null ? Optional.empty() : service;
        LocalDate endDate = LocalDate.now(clock);
        LocalDate startDate = endDate.minusDays(daysBack);

        return analyze(load(filter, startDate, endDate), filter, forecastDays);
    }

    /**
     * Runs the pipeline over a series the caller already holds.
     */
    public AnalysisResult analyzeTrends(CostSeries series, Optional<String> service, int forecastDays) {
        requirePositiveForecastDays(forecastDays);
        if (series.isEmpty()) {
            throw new InsufficientDataException("cost analysis", MINIMUM_POINTS, 0);
        }
        Optional<String> filter = service == null ? Optional.empty() : service;
        return analyze(series, filter, forecastDays);
    }

    public RecommendationSet generateRecommendations(AnalysisResult analysis) {
        RecommendationSet recommendations = recommendationGenerator.generate(analysis);
        log.info("Generated {} recommendations for service={} (estimated savings {})",
                recommendations.totalRecommendations(), analysis.service().orElse("all"),
                recommendations.totalEstimatedSavings());
        return recommendations;
    }

    private CostSeries load(Optional<String> service, LocalDate startDate, LocalDate endDate) {
        try {
            List<CostPoint> points = loader.loadDailyCosts(service, startDate, endDate);
            if (points == null) {
                throw new UpstreamFailureException("Cost loader returned no result for " + startDate + ".." + endDate);
            }
            return new CostSeries(points);
        } catch (UpstreamFailureException ex) {
            log.warn("Failed to load daily costs for service={} between {} and {}: {}",
                    service.orElse("all"), startDate, endDate, ex.getMessage());
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Failed to load daily costs for service={} between {} and {}: {}",
                    service.orElse("all"), startDate, endDate, ex.getMessage());
            throw new UpstreamFailureException("Failed to load daily costs between " + startDate + " and " + endDate, ex);
        }
    }

    private AnalysisResult analyze(CostSeries series, Optional<String> service, int forecastDays) {
        if (series.size() < MINIMUM_POINTS) {
            throw new InsufficientDataException("cost analysis", MINIMUM_POINTS, series.size());
        }
        log.info("Analyzing {} daily cost points for service={} ({}..{}), forecasting {} days",
                series.size(), service.orElse("all"), series.first().date(), series.last().date(), forecastDays);

        Outcome<TrendDecomposition> decomposition = trendDecomposer.decompose(series);
        Outcome<SeasonalityReport> seasonality = seasonalityDetector.detect(series);
        Outcome<TrendMetrics> trendMetrics = trendMetricsCalculator.calculate(series);
        boolean weeklySeasonality = seasonality.asOptional()
                .map(report -> report.weekly().detected())
                .orElse(false);
        Outcome<ForecastReport> forecasts = forecastEnsemble.forecast(series, forecastDays, weeklySeasonality);
        List<Anomaly> anomalies = anomalyDetector.detect(series);
        List<ChangePoint> changePoints = changePointDetector.detect(series);
        Outcome<VolatilityProfile> volatility = volatilityAnalyzer.analyze(series);

        AnalysisResult.Summary summary = new AnalysisResult.Summary(
                trendMetrics.asOptional().map(TrendMetrics::direction),
                trendMetrics.asOptional().map(TrendMetrics::strength).orElse(0d),
                forecasts.asOptional().map(ForecastReport::confidence).orElse(0d),
                anomalies.size(),
                seasonality.asOptional().map(SeasonalityReport::hasSeasonality).orElse(false)
        );

        log.info("Analysis complete for service={}: trend={}, anomalies={}, changePoints={}, forecastConfidence={}",
                service.orElse("all"), summary.overallTrend().map(Enum::name).orElse("unavailable"),
                anomalies.size(), changePoints.size(), String.format(Locale.ROOT, "%.2f", summary.forecastConfidence()));

        // observed range, which may be narrower than the requested window when days have no costs
        AnalysisResult.AnalysisPeriod period =
                new AnalysisResult.AnalysisPeriod(series.first().date(), series.last().date(), series.size());

        return new AnalysisResult(
                service,
                period,
                decomposition,
                seasonality,
                trendMetrics,
                forecasts,
                anomalies,
                changePoints,
                volatility,
                summary,
                Instant.now(clock)
        );
    }

    private static void requirePositiveForecastDays(int forecastDays) {
        if (forecastDays <= 0) {
            throw new IllegalArgumentException("forecastDays must be positive");
        }
    }
}
