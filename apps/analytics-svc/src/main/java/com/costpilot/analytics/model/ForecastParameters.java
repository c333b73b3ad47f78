package com.costpilot.analytics.model;

import java.util.List;

/**
 * Fitted parameters of a single forecasting method.
 */
public sealed interface ForecastParameters {

    ForecastMethod method();

    record LinearTrend(double slope, double intercept, double rSquared) implements ForecastParameters {
        @Override
        public ForecastMethod method() {
            return ForecastMethod.LINEAR_TREND;
        }
    }

    record ExponentialSmoothing(double alpha, double meanAbsoluteError) implements ForecastParameters {
        @Override
        public ForecastMethod method() {
            return ForecastMethod.EXPONENTIAL_SMOOTHING;
        }
    }

    record MovingAverage(int windowSize, double movingAverage, double stdDev) implements ForecastParameters {
        @Override
        public ForecastMethod method() {
            return ForecastMethod.MOVING_AVERAGE;
        }
    }

    record SeasonalNaive(int seasonLength, List<Double> seasonalPattern) implements ForecastParameters {
        public SeasonalNaive {
            seasonalPattern = List.copyOf(seasonalPattern);
        }

        @Override
        public ForecastMethod method() {
            return ForecastMethod.SEASONAL_NAIVE;
        }
    }
}
