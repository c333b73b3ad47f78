package com.costpilot.analytics.analytics;

import com.costpilot.analytics.exception.DegenerateInputException;
import com.costpilot.analytics.exception.InsufficientDataException;

/**
 * Named preconditions for the analysis steps. Each check throws an
 * {@link com.costpilot.analytics.exception.AnalysisUnavailableException} that the calling
 * component turns into an unavailable outcome.
 */
public final class Guards {

    private static final double DENOMINATOR_EPSILON = 1e-10;

    private Guards() {
    }

    public static void requireMinimum(String analysis, int required, int actual) {
        if (actual < required) {
            throw new InsufficientDataException(analysis, required, actual);
        }
    }

    public static void requireRegressionSpread(double denominator) {
        if (Math.abs(denominator) < DENOMINATOR_EPSILON) {
            throw new DegenerateInputException("regression-spread", "day offsets have no variance");
        }
    }
}
