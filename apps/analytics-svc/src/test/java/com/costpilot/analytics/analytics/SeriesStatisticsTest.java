package com.costpilot.analytics.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.costpilot.analytics.exception.DegenerateInputException;
import com.costpilot.analytics.exception.InsufficientDataException;
import com.costpilot.analytics.model.Outcome;
import org.junit.jupiter.api.Test;

class SeriesStatisticsTest {

    @Test
    void usesSampleVariance() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        assertThat(SeriesStatistics.mean(values)).isEqualTo(5d);
        assertThat(SeriesStatistics.sampleVariance(values)).isCloseTo(32d / 7, within(1e-12));
        assertThat(SeriesStatistics.sampleVariance(new double[]{42})).isZero();
    }

    @Test
    void rangeOverloadsOnlyReadTheSlice() {
        double[] values = {1, 2, 3, 100, 100};

        assertThat(SeriesStatistics.mean(values, 0, 3)).isEqualTo(2d);
        assertThat(SeriesStatistics.stdDev(values, 3, 5)).isZero();
        assertThat(SeriesStatistics.mean(values, 2, 2)).isZero();
    }

    @Test
    void correlationIsZeroWithoutSpread() {
        assertThat(SeriesStatistics.correlationWithIndex(new double[]{5, 5, 5, 5})).isZero();
        assertThat(SeriesStatistics.pearson(new double[]{1, 2}, new double[]{1, 2, 3})).isZero();
        assertThat(SeriesStatistics.correlationWithIndex(new double[]{1, 3, 5, 7})).isCloseTo(1d, within(1e-12));
        assertThat(SeriesStatistics.correlationWithIndex(new double[]{7, 5, 3, 1})).isCloseTo(-1d, within(1e-12));
    }

    @Test
    void guardsRaiseUnavailableReasons() {
        assertThatThrownBy(() -> Guards.requireMinimum("trend metrics", 3, 2))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("requires at least 3 points, got 2")
                .satisfies(ex -> assertThat(((InsufficientDataException) ex).reason()).isEqualTo(Outcome.Reason.INSUFFICIENT_DATA));

        assertThatThrownBy(() -> Guards.requireRegressionSpread(1e-12))
                .isInstanceOf(DegenerateInputException.class)
                .satisfies(ex -> assertThat(((DegenerateInputException) ex).check()).isEqualTo("regression-spread"));
    }
}
