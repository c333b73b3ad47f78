package com.costpilot.analytics.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Immutable daily cost series ordered by strictly increasing date.
 */
public record CostSeries(List<CostPoint> points) {

    public CostSeries {
        if (points == null) {
            throw new IllegalArgumentException("points must be provided");
        }
        points = List.copyOf(points);
        for (int i = 1; i < points.size(); i++) {
            LocalDate previous = points.get(i - 1).date();
            LocalDate current = points.get(i).date();
            if (!current.isAfter(previous)) {
                throw new IllegalArgumentException("dates must be strictly increasing: " + previous + " followed by " + current);
            }
        }
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public CostPoint first() {
        return points.get(0);
    }

    public CostPoint last() {
        return points.get(points.size() - 1);
    }

    public double[] costs() {
        return points.stream().mapToDouble(CostPoint::cost).toArray();
    }

    public List<LocalDate> dates() {
        return points.stream().map(CostPoint::date).toList();
    }
}
