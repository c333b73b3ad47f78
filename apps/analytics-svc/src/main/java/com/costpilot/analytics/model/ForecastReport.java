package com.costpilot.analytics.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Forecast section of an analysis: every individual method, the weighted ensemble, its prediction
 * intervals and the overall confidence score.
 */
public record ForecastReport(
        int forecastDays,
        Map<ForecastMethod, Outcome<ForecastResult>> individual,
        Outcome<EnsembleForecast> ensemble,
        Outcome<PredictionIntervals> predictionIntervals,
        double confidence,
        LocalDate forecastStartDate,
        LocalDate forecastEndDate
) {
    public ForecastReport {
        individual = Collections.unmodifiableMap(new EnumMap<>(individual));
    }

    public long successfulMethods() {
        return individual.values().stream().filter(Outcome::isAvailable).count();
    }
}
