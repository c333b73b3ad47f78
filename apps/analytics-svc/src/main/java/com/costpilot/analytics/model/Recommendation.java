package com.costpilot.analytics.model;

import java.util.List;
import java.util.Optional;

public record Recommendation(
        Type type,
        Priority priority,
        String title,
        String description,
        List<String> actions,
        double estimatedSavings,
        String impact,
        Optional<String> service
) {
    public Recommendation {
        actions = List.copyOf(actions);
        service = service == null ? Optional.empty() : service;
    }

    public enum Type {
        VOLATILITY_MANAGEMENT,
        GROWTH_CONTROL,
        ANOMALY_PREVENTION,
        BUDGET_PLANNING,
        SERVICE_OPTIMIZATION
    }

    /**
     * Declared from most to least urgent; ordinal order is sort order.
     */
    public enum Priority {
        HIGH,
        MEDIUM,
        LOW
    }
}
