package com.costpilot.analytics.analytics;

import com.costpilot.analytics.exception.AnalysisUnavailableException;
import com.costpilot.analytics.model.CostSeries;
import com.costpilot.analytics.model.Outcome;
import com.costpilot.analytics.model.VolatilityProfile;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class VolatilityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(VolatilityAnalyzer.class);

    static final int MINIMUM_POINTS = 3;
    private static final int MAX_WINDOW = 7;
    private static final int MINIMUM_WINDOW = 3;
    private static final int MINIMUM_ROLLING_FOR_TREND = 3;
    private static final double TREND_THRESHOLD = 0.2d;
    private static final double HIGH_PERIOD_FACTOR = 1.5d;

    public Outcome<VolatilityProfile> analyze(CostSeries series) {
        try {
            Guards.requireMinimum("volatility analysis", MINIMUM_POINTS, series.size());
            return Outcome.of(profile(series.costs()));
        } catch (AnalysisUnavailableException ex) {
            log.debug("Volatility analysis unavailable: {}", ex.getMessage());
            return Outcome.unavailable(ex);
        }
    }

    private VolatilityProfile profile(double[] costs) {
        double mean = SeriesStatistics.mean(costs);
        double stdDev = SeriesStatistics.stdDev(costs);
        double cv = mean > 0 ? stdDev / mean : 0d;

        List<Double> rolling = new ArrayList<>();
        int window = Math.min(MAX_WINDOW, costs.length / 3);
        if (window >= MINIMUM_WINDOW) {
            for (int end = window; end <= costs.length; end++) {
                rolling.add(SeriesStatistics.stdDev(costs, end - window, end));
            }
        }

        double volatilityTrend = 0d;
        VolatilityProfile.TrendDescription description = VolatilityProfile.TrendDescription.UNKNOWN;
        if (rolling.size() >= MINIMUM_ROLLING_FOR_TREND) {
            volatilityTrend = SeriesStatistics.correlationWithIndex(SeriesStatistics.toArray(rolling));
            if (volatilityTrend > TREND_THRESHOLD) {
                description = VolatilityProfile.TrendDescription.INCREASING;
            } else if (volatilityTrend < -TREND_THRESHOLD) {
                description = VolatilityProfile.TrendDescription.DECREASING;
            } else {
                description = VolatilityProfile.TrendDescription.STABLE;
            }
        }

        double averageRolling = SeriesStatistics.mean(rolling);
        int highPeriods = (int) rolling.stream()
                .filter(value -> value > averageRolling * HIGH_PERIOD_FACTOR)
                .count();

        double min = SeriesStatistics.min(costs);
        double max = SeriesStatistics.max(costs);
        return new VolatilityProfile(
                stdDev,
                cv,
                classify(cv),
                rolling,
                averageRolling,
                volatilityTrend,
                description,
                highPeriods,
                rolling.size(),
                min,
                max,
                max - min
        );
    }

    static VolatilityProfile.Level classify(double coefficientOfVariation) {
        if (coefficientOfVariation < 0.1) {
            return VolatilityProfile.Level.LOW;
        }
        if (coefficientOfVariation < 0.3) {
            return VolatilityProfile.Level.MODERATE;
        }
        if (coefficientOfVariation < 0.5) {
            return VolatilityProfile.Level.HIGH;
        }
        return VolatilityProfile.Level.VERY_HIGH;
    }
}
