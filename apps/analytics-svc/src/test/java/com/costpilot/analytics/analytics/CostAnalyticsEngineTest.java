package com.costpilot.analytics.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.costpilot.analytics.analytics.forecast.ConfidenceScorer;
import com.costpilot.analytics.analytics.forecast.ForecastEnsemble;
import com.costpilot.analytics.analytics.forecast.Forecaster;
import com.costpilot.analytics.analytics.forecast.PredictionIntervalCalculator;
import com.costpilot.analytics.config.CostPilotProperties;
import com.costpilot.analytics.exception.InsufficientDataException;
import com.costpilot.analytics.exception.UpstreamFailureException;
import com.costpilot.analytics.model.AnalysisResult;
import com.costpilot.analytics.model.CostPoint;
import com.costpilot.analytics.model.CostSeries;
import com.costpilot.analytics.model.Outcome;
import com.costpilot.analytics.model.Recommendation;
import com.costpilot.analytics.model.RecommendationSet;
import com.costpilot.analytics.model.TrendDirection;
import com.costpilot.analytics.repository.DailyCostLoader;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class CostAnalyticsEngineTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    @Mock
    private DailyCostLoader loader;

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
    private CostAnalyticsEngine engine;

    @BeforeEach
    void setUp() {
        CostPilotProperties properties = CostPilotProperties.defaults();
        engine = new CostAnalyticsEngine(
                loader,
                properties,
                new TrendDecomposer(),
                new SeasonalityDetector(),
                new TrendMetricsCalculator(),
                new ForecastEnsemble(new Forecaster(properties), new PredictionIntervalCalculator(), new ConfidenceScorer()),
                new AnomalyDetector(properties),
                new ChangePointDetector(properties),
                new VolatilityAnalyzer(),
                new RecommendationGenerator(properties, clock),
                clock
        );
    }

    @Test
    void loadsRequestedWindowEndingToday() {
        when(loader.loadDailyCosts(Optional.of("openai"), TODAY.minusDays(30), TODAY))
                .thenReturn(TestSeries.linear(30).points());

        AnalysisResult result = engine.analyzeTrends(Optional.of("openai"), 30, 7);

        assertThat(result.service()).contains("openai");
        assertThat(result.analysisPeriod())
                .isEqualTo(new AnalysisResult.AnalysisPeriod(TestSeries.START, TestSeries.START.plusDays(29), 30));
        assertThat(result.generatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void periodCoversObservedDaysWhenRequestedWindowHasGaps() {
        LocalDate firstObserved = TODAY.minusDays(20);
        when(loader.loadDailyCosts(Optional.empty(), TODAY.minusDays(30), TODAY))
                .thenReturn(TestSeries.daily(firstObserved, Collections.nCopies(19, 100d)).points());

        AnalysisResult result = engine.analyzeTrends(Optional.empty(), 30, 7);

        assertThat(result.analysisPeriod())
                .isEqualTo(new AnalysisResult.AnalysisPeriod(firstObserved, TODAY.minusDays(2), 19));
    }

    @Test
    void defaultOverloadUsesConfiguredWindow() {
        when(loader.loadDailyCosts(Optional.empty(), TODAY.minusDays(90), TODAY))
                .thenReturn(TestSeries.linear(90).points());

        AnalysisResult result = engine.analyzeTrends(Optional.empty());

        assertThat(result.forecasts().value().forecastDays()).isEqualTo(30);
    }

    @Test
    void increasingSeriesProducesFullReport() {
        AnalysisResult result = engine.analyzeTrends(TestSeries.linear(30), Optional.empty(), 14);

        assertThat(result.trendComponents().isAvailable()).isTrue();
        assertThat(result.seasonality().isAvailable()).isTrue();
        assertThat(result.trendMetrics().value().direction()).isEqualTo(TrendDirection.INCREASING);
        assertThat(result.summary().overallTrend()).contains(TrendDirection.INCREASING);
        assertThat(result.summary().seasonalityDetected()).isFalse();
        assertThat(result.summary().forecastConfidence()).isBetween(0.10, 0.95);
        assertThat(result.volatilityAnalysis().isAvailable()).isTrue();
        assertThat(result.forecasts().value().ensemble().value().values()).hasSize(14);
        verifyNoInteractions(loader);
    }

    @Test
    void tenPointSeriesSucceedsWithoutDecomposition() {
        AnalysisResult result = engine.analyzeTrends(TestSeries.linear(10), Optional.empty(), 7);

        assertThat(result.trendComponents().isAvailable()).isFalse();
        assertThat(result.trendComponents().unavailability().reason()).isEqualTo(Outcome.Reason.INSUFFICIENT_DATA);
        assertThat(result.seasonality().isAvailable()).isFalse();
        assertThat(result.forecasts().isAvailable()).isTrue();
        assertThat(result.trendMetrics().isAvailable()).isTrue();
    }

    @Test
    void flatSeriesIsQuiet() {
        AnalysisResult result = engine.analyzeTrends(TestSeries.constant(14, 100), Optional.empty(), 7);

        assertThat(result.trendComponents().value().quality()).isEqualTo(1d);
        assertThat(result.seasonality().value().hasSeasonality()).isFalse();
        assertThat(result.anomalies()).isEmpty();
        assertThat(result.changePoints()).isEmpty();
        assertThat(result.trendMetrics().value().direction()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    void rejectsSeriesShorterThanAWeek() {
        when(loader.loadDailyCosts(any(), any(), any())).thenReturn(TestSeries.linear(6).points());

        assertThatThrownBy(() -> engine.analyzeTrends(Optional.empty(), 30, 7))
                .isInstanceOf(InsufficientDataException.class)
                .satisfies(ex -> {
                    InsufficientDataException insufficient = (InsufficientDataException) ex;
                    assertThat(insufficient.required()).isEqualTo(7);
                    assertThat(insufficient.actual()).isEqualTo(6);
                });
    }

    @Test
    void wrapsLoaderFailures() {
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("connection refused");
        when(loader.loadDailyCosts(any(), any(), any())).thenThrow(failure);

        assertThatThrownBy(() -> engine.analyzeTrends(Optional.empty(), 30, 7))
                .isInstanceOf(UpstreamFailureException.class)
                .hasCause(failure);
    }

    @Test
    void rejectsMalformedLoaderData() {
        List<CostPoint> unordered = List.of(CostPoint.of(TODAY, 10), CostPoint.of(TODAY.minusDays(1), 10));
        when(loader.loadDailyCosts(any(), any(), any())).thenReturn(unordered);

        assertThatThrownBy(() -> engine.analyzeTrends(Optional.empty(), 30, 7))
                .isInstanceOf(UpstreamFailureException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingLoaderResultIsAnUpstreamFailure() {
        when(loader.loadDailyCosts(any(), any(), any())).thenReturn(null);

        assertThatThrownBy(() -> engine.analyzeTrends(Optional.empty(), 30, 7))
                .isInstanceOf(UpstreamFailureException.class);
    }

    @Test
    void validatesArguments() {
        assertThatThrownBy(() -> engine.analyzeTrends(Optional.empty(), 0, 7))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("daysBack");
        assertThatThrownBy(() -> engine.analyzeTrends(Optional.empty(), 30, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("forecastDays");
        verifyNoInteractions(loader);
    }

    @Test
    void repeatedAnalysisIsIdentical() {
        CostSeries series = TestSeries.generated(60, i -> 100 + 3 * i + (i % 7 == 5 ? 80 : 0) + (i == 40 ? 600 : 0));

        AnalysisResult first = engine.analyzeTrends(series, Optional.of("semrush"), 30);
        AnalysisResult second = engine.analyzeTrends(series, Optional.of("semrush"), 30);

        assertThat(second).isEqualTo(first);
        assertThat(engine.generateRecommendations(second)).isEqualTo(engine.generateRecommendations(first));
    }

    @Test
    void recommendationsFollowAnalysis() {
        when(loader.loadDailyCosts(Optional.of("openai"), TODAY.minusDays(30), TODAY))
                .thenReturn(TestSeries.generated(30, i -> 50 + 20 * i).points());

        RecommendationSet recommendations = engine.generateRecommendations(engine.analyzeTrends(Optional.of("openai"), 30, 30));

        verify(loader).loadDailyCosts(Optional.of("openai"), TODAY.minusDays(30), TODAY);
        assertThat(recommendations.recommendations()).isNotEmpty();
        assertThat(recommendations.recommendations().get(0).priority())
                .isEqualTo(Recommendation.Priority.HIGH);
        assertThat(recommendations.analysisSummary().trendDirection()).contains(TrendDirection.INCREASING);
    }
}
