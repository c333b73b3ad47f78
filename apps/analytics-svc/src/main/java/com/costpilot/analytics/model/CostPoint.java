package com.costpilot.analytics.model;

import java.time.LocalDate;

/**
 * Aggregated spend for one calendar day.
 */
public record CostPoint(
        LocalDate date,
        double cost,
        long transactionCount,
        double avgTransactionCost
) {
    public CostPoint {
        if (date == null) {
            throw new IllegalArgumentException("date must be provided");
        }
        if (!Double.isFinite(cost) || cost < 0) {
            throw new IllegalArgumentException("cost must be a finite non-negative number, got " + cost + " on " + date);
        }
        if (transactionCount < 0) {
            throw new IllegalArgumentException("transactionCount must not be negative on " + date);
        }
    }

    public static CostPoint of(LocalDate date, double cost) {
        return new CostPoint(date, cost, 1, cost);
    }
}
