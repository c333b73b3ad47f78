package com.costpilot.analytics.model;

public enum ForecastMethod {
    LINEAR_TREND,
    EXPONENTIAL_SMOOTHING,
    MOVING_AVERAGE,
    SEASONAL_NAIVE
}
