package com.costpilot.analytics.analytics;

import com.costpilot.analytics.config.CostPilotProperties;
import com.costpilot.analytics.model.Anomaly;
import com.costpilot.analytics.model.CostPoint;
import com.costpilot.analytics.model.CostSeries;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Runs the z-score, IQR, rolling-deviation and day-of-week detectors over a series and merges
 * their findings so that each date is reported at most once, at its highest severity.
 */
@Component
public class AnomalyDetector {

    static final int MINIMUM_POINTS = 7;
    private static final int Z_SCORE_MINIMUM = 3;
    private static final int IQR_MINIMUM = 4;
    private static final int ROLLING_MINIMUM = 5;
    private static final int DAY_OF_WEEK_MINIMUM = 14;
    private static final int MAX_ROLLING_WINDOW = 7;
    private static final int SEVERITY_SCALE = 3;

    private final CostPilotProperties.AnomalyDetection settings;

    public AnomalyDetector(CostPilotProperties properties) {
        this.settings = properties.anomalyDetection();
    }

    public List<Anomaly> detect(CostSeries series) {
        if (series.size() < MINIMUM_POINTS) {
            return List.of();
        }
        Map<LocalDate, Anomaly> byDate = new LinkedHashMap<>();
        for (Anomaly.Method method : Anomaly.Method.values()) {
            for (Anomaly anomaly : detect(method, series)) {
                Anomaly existing = byDate.get(anomaly.date());
                if (existing == null || anomaly.severity() > existing.severity()) {
                    byDate.put(anomaly.date(), anomaly);
                }
            }
        }
        return byDate.values().stream()
                .sorted(Comparator.comparingInt(Anomaly::severity).reversed()
                        .thenComparing(Anomaly::date))
                .limit(settings.maxReported())
                .toList();
    }

    List<Anomaly> detect(Anomaly.Method method, CostSeries series) {
        return switch (method) {
            case Z_SCORE -> zScore(series);
            case IQR -> interquartileRange(series);
            case ROLLING_DEVIATION -> rollingDeviation(series);
            case DAY_OF_WEEK -> dayOfWeek(series);
        };
    }

    private List<Anomaly> zScore(CostSeries series) {
        double[] costs = series.costs();
        if (costs.length < Z_SCORE_MINIMUM) {
            return List.of();
        }
        double mean = SeriesStatistics.mean(costs);
        double stdDev = SeriesStatistics.stdDev(costs);
        if (stdDev == 0) {
            return List.of();
        }
        double threshold = settings.zScoreThreshold();
        List<Anomaly> anomalies = new ArrayList<>();
        for (CostPoint point : series.points()) {
            double z = Math.abs(point.cost() - mean) / stdDev;
            if (z > threshold) {
                anomalies.add(new Anomaly(
                        point.date(),
                        point.cost(),
                        mean,
                        severity((int) (z / threshold * SEVERITY_SCALE)),
                        point.cost() > mean ? Anomaly.Type.HIGH : Anomaly.Type.LOW,
                        Anomaly.Method.Z_SCORE,
                        String.format(Locale.ROOT, "Cost was %.1f standard deviations from mean", z)
                ));
            }
        }
        return anomalies;
    }

    private List<Anomaly> interquartileRange(CostSeries series) {
        double[] sorted = series.costs();
        int n = sorted.length;
        if (n < IQR_MINIMUM) {
            return List.of();
        }
        Arrays.sort(sorted);
        double q1 = sorted[n / 4];
        double q3 = sorted[3 * n / 4];
        double iqr = q3 - q1;
        if (iqr == 0) {
            return List.of();
        }
        double lower = q1 - settings.iqrMultiplier() * iqr;
        double upper = q3 + settings.iqrMultiplier() * iqr;
        String description = String.format(Locale.ROOT, "Cost outside IQR bounds (%.2f, %.2f)", lower, upper);

        List<Anomaly> anomalies = new ArrayList<>();
        for (CostPoint point : series.points()) {
            if (point.cost() >= lower && point.cost() <= upper) {
                continue;
            }
            boolean high = point.cost() > upper;
            double quartile = high ? q3 : q1;
            double deviation = Math.abs(point.cost() - quartile);
            anomalies.add(new Anomaly(
                    point.date(),
                    point.cost(),
                    quartile,
                    severity((int) (deviation / iqr) + 1),
                    high ? Anomaly.Type.HIGH : Anomaly.Type.LOW,
                    Anomaly.Method.IQR,
                    description
            ));
        }
        return anomalies;
    }

    private List<Anomaly> rollingDeviation(CostSeries series) {
        double[] costs = series.costs();
        int n = costs.length;
        if (n < ROLLING_MINIMUM) {
            return List.of();
        }
        int window = Math.min(MAX_ROLLING_WINDOW, n / 3);
        List<LocalDate> dates = series.dates();
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = window; i < n; i++) {
            double movingAverage = SeriesStatistics.mean(costs, i - window, i);
            double movingStd = SeriesStatistics.stdDev(costs, i - window, i);
            if (movingStd <= 0) {
                continue;
            }
            double deviation = Math.abs(costs[i] - movingAverage);
            if (deviation > settings.rollingDeviationMultiplier() * movingStd) {
                anomalies.add(new Anomaly(
                        dates.get(i),
                        costs[i],
                        movingAverage,
                        severity((int) (deviation / movingStd)),
                        costs[i] > movingAverage ? Anomaly.Type.HIGH : Anomaly.Type.LOW,
                        Anomaly.Method.ROLLING_DEVIATION,
                        String.format(Locale.ROOT, "Cost deviated %.2f from %d-day moving average", deviation, window)
                ));
            }
        }
        return anomalies;
    }

    private List<Anomaly> dayOfWeek(CostSeries series) {
        if (series.size() < DAY_OF_WEEK_MINIMUM) {
            return List.of();
        }
        Map<DayOfWeek, List<Double>> byWeekday = new EnumMap<>(DayOfWeek.class);
        for (CostPoint point : series.points()) {
            byWeekday.computeIfAbsent(point.date().getDayOfWeek(), day -> new ArrayList<>()).add(point.cost());
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (CostPoint point : series.points()) {
            DayOfWeek weekday = point.date().getDayOfWeek();
            List<Double> samples = byWeekday.get(weekday);
            if (samples.size() < 2) {
                continue;
            }
            double mean = SeriesStatistics.mean(samples);
            double std = SeriesStatistics.stdDev(samples);
            double deviation = Math.abs(point.cost() - mean);
            if (std > 0 && deviation > settings.weekdayDeviationMultiplier() * std) {
                boolean high = point.cost() > mean;
                anomalies.add(new Anomaly(
                        point.date(),
                        point.cost(),
                        mean,
                        severity((int) (deviation / std)),
                        high ? Anomaly.Type.HIGH : Anomaly.Type.LOW,
                        Anomaly.Method.DAY_OF_WEEK,
                        String.format(Locale.ROOT, "Unusual cost for %s: %.2f %s normal",
                                weekday.getDisplayName(TextStyle.FULL, Locale.ENGLISH), deviation, high ? "above" : "below")
                ));
            }
        }
        return anomalies;
    }

    private int severity(int raw) {
        return Math.max(Anomaly.MIN_SEVERITY, Math.min(Anomaly.MAX_SEVERITY, raw));
    }
}
