package com.costpilot.analytics.model;

import java.time.LocalDate;

public record ChangePoint(
        LocalDate date,
        int index,
        Type type,
        double beforeMean,
        double afterMean,
        double magnitude,
        double relativeMagnitudePct,
        double significance,
        String description
) {
    public enum Type {
        INCREASE,
        DECREASE
    }
}
