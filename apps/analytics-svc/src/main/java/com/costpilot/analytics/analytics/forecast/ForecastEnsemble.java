package com.costpilot.analytics.analytics.forecast;

import com.costpilot.analytics.analytics.Guards;
import com.costpilot.analytics.exception.AnalysisUnavailableException;
import com.costpilot.analytics.exception.DegenerateInputException;
import com.costpilot.analytics.model.CostSeries;
import com.costpilot.analytics.model.EnsembleForecast;
import com.costpilot.analytics.model.ForecastMethod;
import com.costpilot.analytics.model.ForecastParameters;
import com.costpilot.analytics.model.ForecastReport;
import com.costpilot.analytics.model.ForecastResult;
import com.costpilot.analytics.model.Outcome;
import com.costpilot.analytics.model.PredictionIntervals;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs every {@link ForecastMethod} and combines the successful ones into a quality-weighted
 * ensemble with prediction intervals and an overall confidence score.
 */
@Component
public class ForecastEnsemble {

    private static final Logger log = LoggerFactory.getLogger(ForecastEnsemble.class);

    public static final int MINIMUM_POINTS = 7;
    private static final double MOVING_AVERAGE_WEIGHT = 0.8d;
    private static final double SEASONAL_NAIVE_WEIGHT = 0.7d;

    private final Forecaster forecaster;
    private final PredictionIntervalCalculator intervalCalculator;
    private final ConfidenceScorer confidenceScorer;

    public ForecastEnsemble(Forecaster forecaster,
                            PredictionIntervalCalculator intervalCalculator,
                            ConfidenceScorer confidenceScorer) {
        this.forecaster = forecaster;
        this.intervalCalculator = intervalCalculator;
        this.confidenceScorer = confidenceScorer;
    }

    /**
     * @param weeklySeasonality whether the seasonal-naive forecast may join the ensemble; it is
     *                          always reported among the individual forecasts
     */
    public Outcome<ForecastReport> forecast(CostSeries series, int forecastDays, boolean weeklySeasonality) {
        if (forecastDays <= 0) {
            throw new IllegalArgumentException("forecastDays must be positive");
        }
        try {
            Guards.requireMinimum("forecast ensemble", MINIMUM_POINTS, series.size());
        } catch (AnalysisUnavailableException ex) {
            log.debug("Forecast unavailable: {}", ex.getMessage());
            return Outcome.unavailable(ex);
        }

        Map<ForecastMethod, Outcome<ForecastResult>> individual = new EnumMap<>(ForecastMethod.class);
        Map<ForecastMethod, ForecastResult> successful = new EnumMap<>(ForecastMethod.class);
        for (ForecastMethod method : ForecastMethod.values()) {
            Outcome<ForecastResult> outcome = forecaster.forecast(method, series, forecastDays);
            individual.put(method, outcome);
            outcome.asOptional().ifPresent(result -> successful.put(method, result));
        }

        Map<ForecastMethod, ForecastResult> components = new EnumMap<>(successful);
        if (!weeklySeasonality) {
            components.remove(ForecastMethod.SEASONAL_NAIVE);
        }
        List<LocalDate> dates = Forecaster.forecastDates(series, forecastDays);
        Outcome<EnsembleForecast> ensemble = combine(components, dates);
        Outcome<PredictionIntervals> intervals = ensemble.isAvailable()
                ? intervalCalculator.calculate(series.costs(), ensemble.value().values())
                : new Outcome<>(null, ensemble.unavailability());
        double confidence = confidenceScorer.score(series.costs(), successful.values());

        return Outcome.of(new ForecastReport(
                forecastDays,
                individual,
                ensemble,
                intervals,
                confidence,
                dates.get(0),
                dates.get(dates.size() - 1)
        ));
    }

    /**
     * Weighted average of the given forecasts. Each method contributes only for the days it
     * produced a value for; negative sums are clamped to 0.
     */
    public Outcome<EnsembleForecast> combine(Map<ForecastMethod, ForecastResult> forecasts, List<LocalDate> dates) {
        if (forecasts.isEmpty()) {
            DegenerateInputException ex = new DegenerateInputException("ensemble-components", "no forecasting method succeeded");
            log.debug("Ensemble unavailable: {}", ex.getMessage());
            return Outcome.unavailable(ex);
        }
        Map<ForecastMethod, Double> weights = normalizedWeights(forecasts);

        List<Double> values = new ArrayList<>(dates.size());
        for (int day = 0; day < dates.size(); day++) {
            double weighted = 0d;
            for (Map.Entry<ForecastMethod, ForecastResult> entry : forecasts.entrySet()) {
                List<Double> methodValues = entry.getValue().forecastValues();
                if (day < methodValues.size()) {
                    weighted += weights.get(entry.getKey()) * methodValues.get(day);
                }
            }
            values.add(Math.max(0d, weighted));
        }
        return Outcome.of(new EnsembleForecast(forecasts.keySet(), weights, values, dates));
    }

    private Map<ForecastMethod, Double> normalizedWeights(Map<ForecastMethod, ForecastResult> forecasts) {
        Map<ForecastMethod, Double> raw = new EnumMap<>(ForecastMethod.class);
        forecasts.forEach((method, result) -> raw.put(method, rawWeight(result.parameters())));
        double total = raw.values().stream().mapToDouble(Double::doubleValue).sum();

        Map<ForecastMethod, Double> weights = new EnumMap<>(ForecastMethod.class);
        raw.forEach((method, weight) -> weights.put(method, total > 0 ? weight / total : 1d / raw.size()));
        return weights;
    }

    static double rawWeight(ForecastParameters parameters) {
        if (parameters instanceof ForecastParameters.LinearTrend linear) {
            return Math.max(0d, linear.rSquared());
        }
        if (parameters instanceof ForecastParameters.ExponentialSmoothing smoothing) {
            return 1d / (1d + smoothing.meanAbsoluteError());
        }
        if (parameters instanceof ForecastParameters.MovingAverage) {
            return MOVING_AVERAGE_WEIGHT;
        }
        return SEASONAL_NAIVE_WEIGHT;
    }
}
