package com.costpilot.analytics.analytics;

import com.costpilot.analytics.exception.AnalysisUnavailableException;
import com.costpilot.analytics.model.CostSeries;
import com.costpilot.analytics.model.Outcome;
import com.costpilot.analytics.model.TrendDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits a daily series into a centered moving-average trend, a weekly seasonal component and
 * residuals. The weekly component is positional: index {@code i} belongs to slot {@code i % 7}.
 * <p>
 * Variance shares are taken over the summed component variances, while quality is
 * {@code 1 - var(residual) / var(cost)}. The two therefore differ whenever the components are
 * correlated, so quality is not {@code 1 - residualPct / 100}.
 */
@Component
public class TrendDecomposer {

    private static final Logger log = LoggerFactory.getLogger(TrendDecomposer.class);

    static final int MINIMUM_POINTS = 14;
    private static final int MAX_WINDOW = 7;
    private static final int SEASON_LENGTH = 7;

    public Outcome<TrendDecomposition> decompose(CostSeries series) {
        try {
            return Outcome.of(decompose(series.costs()));
        } catch (AnalysisUnavailableException ex) {
            log.debug("Trend decomposition unavailable: {}", ex.getMessage());
            return Outcome.unavailable(ex);
        }
    }

    TrendDecomposition decompose(double[] costs) {
        int n = costs.length;
        Guards.requireMinimum("trend decomposition", MINIMUM_POINTS, n);

        int window = Math.min(MAX_WINDOW, n / 3);
        int half = window / 2;
        double[] trend = new double[n];
        double[] detrended = new double[n];
        for (int i = 0; i < n; i++) {
            trend[i] = SeriesStatistics.mean(costs, Math.max(0, i - half), Math.min(n, i + half + 1));
            detrended[i] = costs[i] - trend[i];
        }

        double[] slotMeans = new double[SEASON_LENGTH];
        for (int slot = 0; slot < SEASON_LENGTH; slot++) {
            double total = 0d;
            int count = 0;
            for (int j = slot; j < n; j += SEASON_LENGTH) {
                total += detrended[j];
                count++;
            }
            slotMeans[slot] = count == 0 ? 0d : total / count;
        }

        double[] seasonal = new double[n];
        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            seasonal[i] = slotMeans[i % SEASON_LENGTH];
            residuals[i] = detrended[i] - seasonal[i];
        }

        double totalVariance = SeriesStatistics.sampleVariance(costs);
        double trendVariance = SeriesStatistics.sampleVariance(trend);
        double seasonalVariance = SeriesStatistics.sampleVariance(seasonal);
        double residualVariance = SeriesStatistics.sampleVariance(residuals);

        TrendDecomposition.VarianceExplained varianceExplained = TrendDecomposition.VarianceExplained.none();
        double componentVariance = trendVariance + seasonalVariance + residualVariance;
        if (totalVariance > 0 && componentVariance > 0) {
            // shares of the summed component variances, so the three always add up to 100
            varianceExplained = new TrendDecomposition.VarianceExplained(
                    trendVariance / componentVariance * 100,
                    seasonalVariance / componentVariance * 100,
                    residualVariance / componentVariance * 100
            );
        }
        double residualRatio = totalVariance > 0 ? residualVariance / totalVariance : 0d;

        return new TrendDecomposition(
                SeriesStatistics.toList(trend),
                SeriesStatistics.toList(seasonal),
                SeriesStatistics.toList(residuals),
                varianceExplained,
                1 - residualRatio
        );
    }
}
