package com.costpilot.analytics.model;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record SeasonalityReport(
        boolean hasSeasonality,
        Weekly weekly,
        Monthly monthly,
        List<DayOfWeek> peakDays,
        List<DayOfWeek> lowDays
) {
    public SeasonalityReport {
        peakDays = List.copyOf(peakDays);
        lowDays = List.copyOf(lowDays);
    }

    /**
     * @param coefficientOfVariation empty when fewer than seven weekdays had two or more samples
     */
    public record Weekly(boolean detected, Map<DayOfWeek, Double> dailyAverages, Optional<Double> coefficientOfVariation) {
        public Weekly {
            dailyAverages = dailyAverages.isEmpty()
                    ? Map.of()
                    : Collections.unmodifiableMap(new EnumMap<>(dailyAverages));
        }
    }

    /**
     * @param coefficientOfVariation empty when the series was too short for the monthly test
     */
    public record Monthly(boolean detected, Optional<Double> coefficientOfVariation) {
    }
}
