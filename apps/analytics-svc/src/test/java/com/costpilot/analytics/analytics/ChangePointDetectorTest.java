package com.costpilot.analytics.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.costpilot.analytics.config.CostPilotProperties;
import com.costpilot.analytics.model.ChangePoint;
import com.costpilot.analytics.model.CostSeries;
import java.util.Comparator;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChangePointDetectorTest {

    private static final double[] WIGGLE = {0, 2, -2};

    private final ChangePointDetector detector = new ChangePointDetector(CostPilotProperties.defaults());

    @Test
    void locatesLevelShift() {
        CostSeries series = TestSeries.generated(30, i -> (i < 15 ? 100 : 200) + WIGGLE[i % 3]);

        List<ChangePoint> changePoints = detector.detect(series);

        assertThat(changePoints).isNotEmpty();
        ChangePoint strongest = changePoints.get(0);
        assertThat(strongest.index()).isEqualTo(15);
        assertThat(strongest.date()).isEqualTo(TestSeries.START.plusDays(15));
        assertThat(strongest.type()).isEqualTo(ChangePoint.Type.INCREASE);
        assertThat(strongest.beforeMean()).isCloseTo(100d, within(1e-9));
        assertThat(strongest.afterMean()).isCloseTo(200d, within(1e-9));
        assertThat(strongest.relativeMagnitudePct()).isCloseTo(100d, within(1e-9));
        assertThat(strongest.significance()).isCloseTo(100 / (2 * Math.sqrt(2d / 3)), within(1e-9));
        assertThat(strongest.description()).isEqualTo("Significant increase of 100.0%");
    }

    @Test
    void reportsDecreases() {
        CostSeries series = TestSeries.generated(30, i -> (i < 15 ? 200 : 100) + WIGGLE[i % 3]);

        assertThat(detector.detect(series).get(0).type()).isEqualTo(ChangePoint.Type.DECREASE);
    }

    @Test
    void skipsWindowsWithoutSpread() {
        assertThat(detector.detect(TestSeries.constant(30, 100))).isEmpty();
    }

    @Test
    void needsTenPoints() {
        assertThat(detector.detect(TestSeries.of(1, 1, 1, 1, 9, 9, 9, 9, 1))).isEmpty();
    }

    @Test
    void returnsAtMostTenSortedBySignificance() {
        CostSeries series = TestSeries.generated(120, i -> (i / 12 % 2 == 0 ? 100 : 300) + WIGGLE[i % 3]);

        List<ChangePoint> changePoints = detector.detect(series);

        assertThat(changePoints).hasSize(10);
        assertThat(changePoints).isSortedAccordingTo(Comparator.comparingDouble(ChangePoint::significance).reversed());
    }
}
