package com.costpilot.analytics.analytics.forecast;

import com.costpilot.analytics.analytics.SeriesStatistics;
import com.costpilot.analytics.model.ForecastResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Averages data quantity, stability, method agreement and trend clarity into a single score
 * bounded to [0.10, 0.95].
 */
@Component
public class ConfidenceScorer {

    static final double SHORT_SERIES_CONFIDENCE = 0.3d;
    static final double MIN_CONFIDENCE = 0.10d;
    static final double MAX_CONFIDENCE = 0.95d;
    private static final int MINIMUM_POINTS = 7;
    private static final int TREND_MINIMUM_POINTS = 5;
    private static final double FULL_DATA_DAYS = 30d;
    private static final double FACTOR_FLOOR = 0.1d;
    private static final double NO_FACTORS_CONFIDENCE = 0.5d;

    public double score(double[] history, Collection<ForecastResult> successfulForecasts) {
        int n = history.length;
        if (n < MINIMUM_POINTS) {
            return SHORT_SERIES_CONFIDENCE;
        }
        List<Double> factors = new ArrayList<>();
        factors.add(Math.min(1d, n / FULL_DATA_DAYS));

        double mean = SeriesStatistics.mean(history);
        if (mean > 0) {
            double variation = SeriesStatistics.stdDev(history) / mean;
            factors.add(Math.max(FACTOR_FLOOR, 1 - Math.min(1d, variation)));
        }

        if (successfulForecasts.size() >= 2) {
            List<Double> firstDay = successfulForecasts.stream()
                    .filter(result -> !result.forecastValues().isEmpty())
                    .map(result -> result.forecastValues().get(0))
                    .toList();
            double firstDayMean = SeriesStatistics.mean(firstDay);
            if (firstDay.size() >= 2 && firstDayMean > 0) {
                double disagreement = SeriesStatistics.stdDev(firstDay) / firstDayMean;
                factors.add(Math.max(FACTOR_FLOOR, 1 - Math.min(1d, disagreement)));
            }
        }

        if (n >= TREND_MINIMUM_POINTS) {
            factors.add(Math.min(1d, Math.abs(SeriesStatistics.correlationWithIndex(history))));
        }

        double confidence = factors.isEmpty() ? NO_FACTORS_CONFIDENCE : SeriesStatistics.mean(factors);
        return Math.min(MAX_CONFIDENCE, Math.max(MIN_CONFIDENCE, confidence));
    }
}
