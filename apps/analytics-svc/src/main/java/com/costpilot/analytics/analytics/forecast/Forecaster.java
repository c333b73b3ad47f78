package com.costpilot.analytics.analytics.forecast;

import com.costpilot.analytics.analytics.Guards;
import com.costpilot.analytics.analytics.SeriesStatistics;
import com.costpilot.analytics.config.CostPilotProperties;
import com.costpilot.analytics.exception.AnalysisUnavailableException;
import com.costpilot.analytics.model.CostSeries;
import com.costpilot.analytics.model.ForecastMethod;
import com.costpilot.analytics.model.ForecastParameters;
import com.costpilot.analytics.model.ForecastResult;
import com.costpilot.analytics.model.Outcome;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Individual forecasting methods. Every method forecasts the days following the last observed
 * date and never returns a negative value.
 */
@Component
public class Forecaster {

    private static final Logger log = LoggerFactory.getLogger(Forecaster.class);

    static final int SEASON_LENGTH = 7;
    private static final int MAX_MOVING_WINDOW = 7;

    private final double smoothingAlpha;

    public Forecaster(CostPilotProperties properties) {
        this.smoothingAlpha = properties.forecasting().smoothingAlpha();
    }

    public Outcome<ForecastResult> forecast(ForecastMethod method, CostSeries series, int forecastDays) {
        try {
            ForecastResult result = switch (method) {
                case LINEAR_TREND -> linearTrend(series, forecastDays);
                case EXPONENTIAL_SMOOTHING -> exponentialSmoothing(series, forecastDays);
                case MOVING_AVERAGE -> movingAverage(series, forecastDays);
                case SEASONAL_NAIVE -> seasonalNaive(series, forecastDays);
            };
            return Outcome.of(result);
        } catch (AnalysisUnavailableException ex) {
            log.debug("Forecast method {} unavailable: {}", method, ex.getMessage());
            return Outcome.unavailable(ex);
        }
    }

    static List<LocalDate> forecastDates(CostSeries series, int forecastDays) {
        LocalDate last = series.last().date();
        List<LocalDate> dates = new ArrayList<>(forecastDays);
        for (int h = 1; h <= forecastDays; h++) {
            dates.add(last.plusDays(h));
        }
        return dates;
    }

    private ForecastResult linearTrend(CostSeries series, int forecastDays) {
        Guards.requireMinimum("linear trend forecast", 2, series.size());
        double[] costs = series.costs();
        LocalDate origin = series.first().date();
        double[] offsets = series.dates().stream()
                .mapToDouble(date -> ChronoUnit.DAYS.between(origin, date))
                .toArray();

        double meanX = SeriesStatistics.mean(offsets);
        double meanY = SeriesStatistics.mean(costs);
        double numerator = 0d;
        double denominator = 0d;
        for (int i = 0; i < costs.length; i++) {
            numerator += (offsets[i] - meanX) * (costs[i] - meanY);
            denominator += (offsets[i] - meanX) * (offsets[i] - meanX);
        }
        Guards.requireRegressionSpread(denominator);
        double slope = numerator / denominator;
        double intercept = meanY - slope * meanX;

        double residualSquares = 0d;
        double totalSquares = 0d;
        for (int i = 0; i < costs.length; i++) {
            double predicted = slope * offsets[i] + intercept;
            residualSquares += (costs[i] - predicted) * (costs[i] - predicted);
            totalSquares += (costs[i] - meanY) * (costs[i] - meanY);
        }
        double rSquared = totalSquares > 0 ? 1 - residualSquares / totalSquares : 0d;

        double lastOffset = offsets[offsets.length - 1];
        List<Double> values = new ArrayList<>(forecastDays);
        for (int h = 1; h <= forecastDays; h++) {
            values.add(Math.max(0d, slope * (lastOffset + h) + intercept));
        }
        return new ForecastResult(
                ForecastMethod.LINEAR_TREND,
                new ForecastParameters.LinearTrend(slope, intercept, rSquared),
                rSquared,
                values,
                forecastDates(series, forecastDays)
        );
    }

    private ForecastResult exponentialSmoothing(CostSeries series, int forecastDays) {
        Guards.requireMinimum("exponential smoothing forecast", 1, series.size());
        double[] costs = series.costs();
        double smoothed = costs[0];
        double absoluteErrors = 0d;
        for (int i = 1; i < costs.length; i++) {
            smoothed = smoothingAlpha * costs[i] + (1 - smoothingAlpha) * smoothed;
            absoluteErrors += Math.abs(costs[i] - smoothed);
        }
        // index 0 is smoothed to itself and contributes no error
        double meanAbsoluteError = absoluteErrors / costs.length;
        double level = Math.max(0d, smoothed);
        return new ForecastResult(
                ForecastMethod.EXPONENTIAL_SMOOTHING,
                new ForecastParameters.ExponentialSmoothing(smoothingAlpha, meanAbsoluteError),
                meanAbsoluteError,
                Collections.nCopies(forecastDays, level),
                forecastDates(series, forecastDays)
        );
    }

    private ForecastResult movingAverage(CostSeries series, int forecastDays) {
        Guards.requireMinimum("moving average forecast", 2, series.size());
        double[] costs = series.costs();
        int window = Math.min(MAX_MOVING_WINDOW, costs.length / 2);
        int from = costs.length - window;
        double average = SeriesStatistics.mean(costs, from, costs.length);
        double stdDev = SeriesStatistics.stdDev(costs, from, costs.length);
        return new ForecastResult(
                ForecastMethod.MOVING_AVERAGE,
                new ForecastParameters.MovingAverage(window, average, stdDev),
                stdDev,
                Collections.nCopies(forecastDays, Math.max(0d, average)),
                forecastDates(series, forecastDays)
        );
    }

    private ForecastResult seasonalNaive(CostSeries series, int forecastDays) {
        Guards.requireMinimum("seasonal-naive forecast", SEASON_LENGTH, series.size());
        double[] costs = series.costs();
        List<Double> pattern = SeriesStatistics.toList(
                Arrays.copyOfRange(costs, costs.length - SEASON_LENGTH, costs.length));
        List<Double> values = new ArrayList<>(forecastDays);
        for (int h = 0; h < forecastDays; h++) {
            values.add(pattern.get(h % SEASON_LENGTH));
        }
        return new ForecastResult(
                ForecastMethod.SEASONAL_NAIVE,
                new ForecastParameters.SeasonalNaive(SEASON_LENGTH, pattern),
                0d,
                values,
                forecastDates(series, forecastDays)
        );
    }
}
