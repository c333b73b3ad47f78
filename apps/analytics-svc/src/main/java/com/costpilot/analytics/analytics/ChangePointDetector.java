package com.costpilot.analytics.analytics;

import com.costpilot.analytics.config.CostPilotProperties;
import com.costpilot.analytics.model.ChangePoint;
import com.costpilot.analytics.model.CostSeries;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Scans a series for mean shifts between adjacent windows using a simplified two-sample t statistic.
 */
@Component
public class ChangePointDetector {

    static final int MINIMUM_POINTS = 10;
    private static final int MINIMUM_WINDOW = 3;

    private final double significanceThreshold;
    private final int maxReported;

    public ChangePointDetector(CostPilotProperties properties) {
        this.significanceThreshold = properties.changePoints().significanceThreshold();
        this.maxReported = properties.changePoints().maxReported();
    }

    public List<ChangePoint> detect(CostSeries series) {
        double[] costs = series.costs();
        int n = costs.length;
        if (n < MINIMUM_POINTS) {
            return List.of();
        }
        List<LocalDate> dates = series.dates();
        int window = Math.max(MINIMUM_WINDOW, n / 10);

        List<ChangePoint> changePoints = new ArrayList<>();
        for (int i = window; i < n - window; i++) {
            double beforeMean = SeriesStatistics.mean(costs, i - window, i);
            double afterMean = SeriesStatistics.mean(costs, i, i + window);
            double pooledStd = Math.sqrt((SeriesStatistics.sampleVariance(costs, i - window, i)
                    + SeriesStatistics.sampleVariance(costs, i, i + window)) / 2);
            if (pooledStd <= 0) {
                continue;
            }
            double magnitude = Math.abs(afterMean - beforeMean);
            double significance = magnitude / (pooledStd * Math.sqrt(2d / window));
            if (significance <= significanceThreshold) {
                continue;
            }
            ChangePoint.Type type = afterMean > beforeMean ? ChangePoint.Type.INCREASE : ChangePoint.Type.DECREASE;
            double relativeMagnitude = beforeMean > 0 ? magnitude / beforeMean * 100 : 0d;
            changePoints.add(new ChangePoint(
                    dates.get(i),
                    i,
                    type,
                    beforeMean,
                    afterMean,
                    magnitude,
                    relativeMagnitude,
                    significance,
                    String.format(Locale.ROOT, "Significant %s of %.1f%%", type.name().toLowerCase(Locale.ROOT), relativeMagnitude)
            ));
        }
        return changePoints.stream()
                .sorted(Comparator.comparingDouble(ChangePoint::significance).reversed())
                .limit(maxReported)
                .toList();
    }
}
