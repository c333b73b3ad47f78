package com.costpilot.analytics.analytics.forecast;

import com.costpilot.analytics.analytics.Guards;
import com.costpilot.analytics.analytics.SeriesStatistics;
import com.costpilot.analytics.exception.AnalysisUnavailableException;
import com.costpilot.analytics.model.Outcome;
import com.costpilot.analytics.model.PredictionIntervals;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Normal-approximation bands around a forecast. The standard error comes from one-step persistence
 * errors on the history and the margin widens by 10% per forecast step.
 */
@Component
public class PredictionIntervalCalculator {

    private static final Logger log = LoggerFactory.getLogger(PredictionIntervalCalculator.class);

    static final int MINIMUM_POINTS = 2;
    private static final double HORIZON_GROWTH = 0.1d;
    private static final double FALLBACK_ERROR_FACTOR = 0.1d;

    public Outcome<PredictionIntervals> calculate(double[] history, List<Double> forecast) {
        try {
            Guards.requireMinimum("prediction intervals", MINIMUM_POINTS, history.length);
        } catch (AnalysisUnavailableException ex) {
            log.debug("Prediction intervals unavailable: {}", ex.getMessage());
            return Outcome.unavailable(ex);
        }

        double standardError = standardError(history);
        Map<PredictionIntervals.ConfidenceLevel, PredictionIntervals.Band> intervals =
                new EnumMap<>(PredictionIntervals.ConfidenceLevel.class);
        for (PredictionIntervals.ConfidenceLevel level : PredictionIntervals.ConfidenceLevel.values()) {
            List<Double> lower = new ArrayList<>(forecast.size());
            List<Double> upper = new ArrayList<>(forecast.size());
            for (int h = 0; h < forecast.size(); h++) {
                double margin = level.zScore() * standardError * (1 + HORIZON_GROWTH * h);
                double value = forecast.get(h);
                lower.add(Math.max(0d, value - margin));
                upper.add(value + margin);
            }
            intervals.put(level, new PredictionIntervals.Band(lower, upper));
        }
        return Outcome.of(new PredictionIntervals(standardError, intervals));
    }

    double standardError(double[] history) {
        double[] errors = new double[history.length - 1];
        for (int i = 1; i < history.length; i++) {
            errors[i - 1] = Math.abs(history[i] - history[i - 1]);
        }
        if (errors.length >= 2) {
            return SeriesStatistics.stdDev(errors);
        }
        return FALLBACK_ERROR_FACTOR * SeriesStatistics.stdDev(history);
    }
}
