package com.costpilot.analytics.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record PredictionIntervals(double standardError, Map<ConfidenceLevel, Band> intervals) {

    public PredictionIntervals {
        intervals = Collections.unmodifiableMap(new EnumMap<>(intervals));
    }

    public Band band(ConfidenceLevel level) {
        return intervals.get(level);
    }

    public enum ConfidenceLevel {
        P80(80, 1.28),
        P90(90, 1.64),
        P95(95, 1.96);

        private final int percent;
        private final double zScore;

        ConfidenceLevel(int percent, double zScore) {
            this.percent = percent;
            this.zScore = zScore;
        }

        public int percent() {
            return percent;
        }

        public double zScore() {
            return zScore;
        }
    }

    public record Band(List<Double> lowerBounds, List<Double> upperBounds) {
        public Band {
            lowerBounds = List.copyOf(lowerBounds);
            upperBounds = List.copyOf(upperBounds);
        }
    }
}
