package com.costpilot.analytics.model;

import java.time.LocalDate;

public record Anomaly(
        LocalDate date,
        double cost,
        double expectedCost,
        int severity,
        Type type,
        Method method,
        String description
) {
    public static final int MIN_SEVERITY = 1;
    public static final int MAX_SEVERITY = 5;

    public Anomaly {
        if (severity < MIN_SEVERITY || severity > MAX_SEVERITY) {
            throw new IllegalArgumentException("severity must be within [1, 5], got " + severity);
        }
    }

    public enum Type {
        HIGH,
        LOW
    }

    public enum Method {
        Z_SCORE,
        IQR,
        ROLLING_DEVIATION,
        DAY_OF_WEEK
    }
}
