package com.costpilot.analytics.analytics;

import java.util.Arrays;
import java.util.List;

/**
 * Descriptive statistics shared by the analysis components. Variances are sample variances
 * (n - 1 denominator).
 */
public final class SeriesStatistics {

    private static final double CORRELATION_EPSILON = 1e-10;

    private SeriesStatistics() {
    }

    public static double sum(double[] values) {
        return Arrays.stream(values).sum();
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    /**
     * Mean of {@code values[from, to)}; 0 for an empty range.
     */
    public static double mean(double[] values, int from, int to) {
        if (to <= from) {
            return 0d;
        }
        double total = 0d;
        for (int i = from; i < to; i++) {
            total += values[i];
        }
        return total / (to - from);
    }

    public static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0d);
    }

    public static double sampleVariance(double[] values) {
        return sampleVariance(values, 0, values.length);
    }

    public static double sampleVariance(double[] values, int from, int to) {
        int count = to - from;
        if (count < 2) {
            return 0d;
        }
        double mean = mean(values, from, to);
        double squares = 0d;
        for (int i = from; i < to; i++) {
            double delta = values[i] - mean;
            squares += delta * delta;
        }
        return squares / (count - 1);
    }

    public static double stdDev(double[] values) {
        return Math.sqrt(sampleVariance(values));
    }

    public static double stdDev(double[] values, int from, int to) {
        return Math.sqrt(sampleVariance(values, from, to));
    }

    public static double stdDev(List<Double> values) {
        return stdDev(toArray(values));
    }

    public static double min(double[] values) {
        return Arrays.stream(values).min().orElse(0d);
    }

    public static double max(double[] values) {
        return Arrays.stream(values).max().orElse(0d);
    }

    /**
     * Pearson correlation of {@code values} against their index 0..n-1.
     */
    public static double correlationWithIndex(double[] values) {
        double[] index = new double[values.length];
        for (int i = 0; i < index.length; i++) {
            index[i] = i;
        }
        return pearson(index, values);
    }

    /**
     * Pearson correlation; 0 when the inputs differ in length, have fewer than two points, or
     * either side has no spread.
     */
    public static double pearson(double[] x, double[] y) {
        if (x.length != y.length || x.length < 2) {
            return 0d;
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double numerator = 0d;
        double sumSquaresX = 0d;
        double sumSquaresY = 0d;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            numerator += dx * dy;
            sumSquaresX += dx * dx;
            sumSquaresY += dy * dy;
        }
        double denominator = Math.sqrt(sumSquaresX * sumSquaresY);
        if (denominator < CORRELATION_EPSILON) {
            return 0d;
        }
        return numerator / denominator;
    }

    public static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public static List<Double> toList(double[] values) {
        return Arrays.stream(values).boxed().toList();
    }
}
