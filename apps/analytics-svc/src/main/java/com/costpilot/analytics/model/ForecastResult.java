package com.costpilot.analytics.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Output of one forecasting method. {@code qualityMetric} is R² for the linear trend, the mean
 * absolute error for exponential smoothing, the window standard deviation for the moving average
 * and 0 for the seasonal-naive forecast.
 */
public record ForecastResult(
        ForecastMethod method,
        ForecastParameters parameters,
        double qualityMetric,
        List<Double> forecastValues,
        List<LocalDate> forecastDates
) {
    public ForecastResult {
        if (parameters.method() != method) {
            throw new IllegalArgumentException("parameters for " + parameters.method() + " do not match " + method);
        }
        forecastValues = List.copyOf(forecastValues);
        forecastDates = List.copyOf(forecastDates);
        if (forecastValues.size() != forecastDates.size()) {
            throw new IllegalArgumentException("forecast values and dates must be aligned");
        }
    }
}
