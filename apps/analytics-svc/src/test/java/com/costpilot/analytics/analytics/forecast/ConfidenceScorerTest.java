package com.costpilot.analytics.analytics.forecast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.costpilot.analytics.model.ForecastMethod;
import com.costpilot.analytics.model.ForecastParameters;
import com.costpilot.analytics.model.ForecastResult;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();

    @Test
    void shortHistoryGetsFixedLowConfidence() {
        assertThat(scorer.score(new double[]{1, 2, 3, 4, 5, 6}, List.of())).isEqualTo(0.3);
    }

    @Test
    void averagesQuantityStabilityAndTrendClarity() {
        double[] flat = new double[30];
        Arrays.fill(flat, 100);

        // quantity 1, stability 1, no trend
        assertThat(scorer.score(flat, List.of())).isCloseTo(2d / 3, within(1e-9));
    }

    @Test
    void includesAgreementBetweenMethods() {
        double[] flat = new double[7];
        Arrays.fill(flat, 100);
        List<ForecastResult> forecasts = List.of(
                movingAverage(100),
                new ForecastResult(ForecastMethod.EXPONENTIAL_SMOOTHING,
                        new ForecastParameters.ExponentialSmoothing(0.3, 0), 0, List.of(100d), List.of(LocalDate.of(2024, 1, 8)))
        );

        assertThat(scorer.score(flat, forecasts)).isCloseTo((7d / 30 + 1 + 1 + 0) / 4, within(1e-9));
    }

    @Test
    void skipsStabilityForZeroCostHistory() {
        assertThat(scorer.score(new double[10], List.of())).isCloseTo((10d / 30 + 0) / 2, within(1e-9));
    }

    @Test
    void clampsToUpperBound() {
        double[] steady = IntStream.range(0, 60).mapToDouble(i -> 1000 + 0.5 * i).toArray();

        assertThat(scorer.score(steady, List.of(movingAverage(1030), movingAverage(1030)))).isEqualTo(0.95);
    }

    private ForecastResult movingAverage(double value) {
        return new ForecastResult(ForecastMethod.MOVING_AVERAGE,
                new ForecastParameters.MovingAverage(7, value, 0), 0, List.of(value), List.of(LocalDate.of(2024, 1, 8)));
    }
}
