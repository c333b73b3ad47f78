package com.costpilot.analytics.analytics;

import com.costpilot.analytics.exception.AnalysisUnavailableException;
import com.costpilot.analytics.model.CostPoint;
import com.costpilot.analytics.model.CostSeries;
import com.costpilot.analytics.model.Outcome;
import com.costpilot.analytics.model.SeasonalityReport;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tests a series for weekly (ISO weekday) and monthly (day-of-month) periodicity.
 */
@Component
public class SeasonalityDetector {

    private static final Logger log = LoggerFactory.getLogger(SeasonalityDetector.class);

    static final int MINIMUM_POINTS = 14;
    static final int MONTHLY_MINIMUM_POINTS = 60;
    private static final int MONTHLY_MINIMUM_GROUPS = 15;
    private static final int MINIMUM_GROUP_SAMPLES = 2;
    private static final double WEEKLY_CV_THRESHOLD = 0.10d;
    private static final double MONTHLY_CV_THRESHOLD = 0.15d;
    private static final double PEAK_FACTOR = 1.2d;
    private static final double LOW_FACTOR = 0.8d;

    public Outcome<SeasonalityReport> detect(CostSeries series) {
        try {
            Guards.requireMinimum("seasonality detection", MINIMUM_POINTS, series.size());
            return Outcome.of(analyze(series));
        } catch (AnalysisUnavailableException ex) {
            log.debug("Seasonality detection unavailable: {}", ex.getMessage());
            return Outcome.unavailable(ex);
        }
    }

    private SeasonalityReport analyze(CostSeries series) {
        double overallMean = SeriesStatistics.mean(series.costs());

        Map<DayOfWeek, List<Double>> byWeekday = new EnumMap<>(DayOfWeek.class);
        Map<Integer, List<Double>> byDayOfMonth = new TreeMap<>();
        for (CostPoint point : series.points()) {
            byWeekday.computeIfAbsent(point.date().getDayOfWeek(), day -> new ArrayList<>()).add(point.cost());
            byDayOfMonth.computeIfAbsent(point.date().getDayOfMonth(), day -> new ArrayList<>()).add(point.cost());
        }

        Map<DayOfWeek, Double> dailyAverages = groupMeans(byWeekday);
        boolean weeklyDetected = false;
        Optional<Double> weeklyCv = Optional.empty();
        if (dailyAverages.size() == DayOfWeek.values().length) {
            double cv = coefficientOfVariation(List.copyOf(dailyAverages.values()), overallMean);
            weeklyCv = Optional.of(cv);
            weeklyDetected = cv > WEEKLY_CV_THRESHOLD;
        }

        boolean monthlyDetected = false;
        Optional<Double> monthlyCv = Optional.empty();
        if (series.size() >= MONTHLY_MINIMUM_POINTS) {
            Map<Integer, Double> monthlyAverages = groupMeans(byDayOfMonth);
            if (monthlyAverages.size() >= MONTHLY_MINIMUM_GROUPS) {
                double cv = coefficientOfVariation(List.copyOf(monthlyAverages.values()), overallMean);
                monthlyCv = Optional.of(cv);
                monthlyDetected = cv > MONTHLY_CV_THRESHOLD;
            }
        }

        List<DayOfWeek> peakDays = new ArrayList<>();
        List<DayOfWeek> lowDays = new ArrayList<>();
        dailyAverages.forEach((day, average) -> {
            if (average > overallMean * PEAK_FACTOR) {
                peakDays.add(day);
            } else if (average < overallMean * LOW_FACTOR) {
                lowDays.add(day);
            }
        });

        return new SeasonalityReport(
                weeklyDetected || monthlyDetected,
                new SeasonalityReport.Weekly(weeklyDetected, dailyAverages, weeklyCv),
                new SeasonalityReport.Monthly(monthlyDetected, monthlyCv),
                peakDays,
                lowDays
        );
    }

    private <K> Map<K, Double> groupMeans(Map<K, List<Double>> groups) {
        Map<K, Double> means = new LinkedHashMap<>();
        groups.forEach((key, values) -> {
            if (values.size() >= MINIMUM_GROUP_SAMPLES) {
                means.put(key, SeriesStatistics.mean(values));
            }
        });
        return means;
    }

    private double coefficientOfVariation(List<Double> groupMeans, double overallMean) {
        if (overallMean <= 0) {
            return 0d;
        }
        return SeriesStatistics.stdDev(groupMeans) / overallMean;
    }
}
