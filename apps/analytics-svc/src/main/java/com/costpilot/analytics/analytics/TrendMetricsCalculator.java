package com.costpilot.analytics.analytics;

import com.costpilot.analytics.exception.AnalysisUnavailableException;
import com.costpilot.analytics.model.CostSeries;
import com.costpilot.analytics.model.Outcome;
import com.costpilot.analytics.model.TrendDirection;
import com.costpilot.analytics.model.TrendMetrics;
import java.time.temporal.ChronoUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class TrendMetricsCalculator {

    private static final Logger log = LoggerFactory.getLogger(TrendMetricsCalculator.class);

    static final int MINIMUM_POINTS = 3;
    private static final double DIRECTION_THRESHOLD = 0.1d;
    private static final int RECENT_WINDOW = 3;

    public Outcome<TrendMetrics> calculate(CostSeries series) {
        try {
            Guards.requireMinimum("trend metrics", MINIMUM_POINTS, series.size());
            return Outcome.of(compute(series));
        } catch (AnalysisUnavailableException ex) {
            log.debug("Trend metrics unavailable: {}", ex.getMessage());
            return Outcome.unavailable(ex);
        }
    }

    private TrendMetrics compute(CostSeries series) {
        double[] costs = series.costs();
        int n = costs.length;
        double average = SeriesStatistics.mean(costs);

        double correlation = SeriesStatistics.correlationWithIndex(costs);
        TrendDirection direction = TrendDirection.STABLE;
        if (correlation > DIRECTION_THRESHOLD) {
            direction = TrendDirection.INCREASING;
        } else if (correlation < -DIRECTION_THRESHOLD) {
            direction = TrendDirection.DECREASING;
        }

        long timeSpanDays = ChronoUnit.DAYS.between(series.first().date(), series.last().date());
        double totalChange = costs[n - 1] - costs[0];
        double dailyChangeRate = timeSpanDays > 0 ? totalChange / timeSpanDays : 0d;
        double percentageChange = costs[0] > 0 ? totalChange / costs[0] * 100 : 0d;

        double volatility = SeriesStatistics.stdDev(costs);
        double coefficientOfVariation = average > 0 ? volatility / average : 0d;

        return new TrendMetrics(
                direction,
                Math.abs(correlation),
                correlation,
                SeriesStatistics.sum(costs),
                average,
                SeriesStatistics.min(costs),
                SeriesStatistics.max(costs),
                dailyChangeRate,
                percentageChange,
                volatility,
                coefficientOfVariation,
                acceleration(costs),
                recentVersusHistorical(costs),
                n,
                timeSpanDays
        );
    }

    // mean of the second differences
    private double acceleration(double[] costs) {
        int count = costs.length - 2;
        if (count < 1) {
            return 0d;
        }
        double total = 0d;
        for (int i = 0; i < count; i++) {
            total += costs[i + 2] - 2 * costs[i + 1] + costs[i];
        }
        return total / count;
    }

    private double recentVersusHistorical(double[] costs) {
        int n = costs.length;
        if (n < RECENT_WINDOW * 2) {
            return 0d;
        }
        double recent = SeriesStatistics.mean(costs, n - RECENT_WINDOW, n);
        double historical = SeriesStatistics.mean(costs, 0, n - RECENT_WINDOW);
        return historical > 0 ? (recent - historical) / historical * 100 : 0d;
    }
}
