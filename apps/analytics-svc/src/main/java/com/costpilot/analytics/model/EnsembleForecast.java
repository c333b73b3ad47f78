package com.costpilot.analytics.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record EnsembleForecast(
        Set<ForecastMethod> componentMethods,
        Map<ForecastMethod, Double> weights,
        List<Double> values,
        List<LocalDate> dates
) {
    public EnsembleForecast {
        if (componentMethods.isEmpty()) {
            throw new IllegalArgumentException("ensemble needs at least one component method");
        }
        componentMethods = Collections.unmodifiableSet(EnumSet.copyOf(componentMethods));
        weights = Collections.unmodifiableMap(new EnumMap<>(weights));
        values = List.copyOf(values);
        dates = List.copyOf(dates);
    }

    public double total() {
        return values.stream().mapToDouble(Double::doubleValue).sum();
    }
}
