package com.costpilot.analytics.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "costpilot")
public record CostPilotProperties(
        Analysis analysis,
        Forecasting forecasting,
        AnomalyDetection anomalyDetection,
        ChangePoints changePoints,
        Recommendations recommendations
) {

    @ConstructorBinding
    public CostPilotProperties {
        // every section is optional; absent sections fall back to the built-in defaults
        analysis = analysis != null ? analysis : new Analysis(null, null);
        forecasting = forecasting != null ? forecasting : new Forecasting(null);
        anomalyDetection = anomalyDetection != null ? anomalyDetection : new AnomalyDetection(null, null, null, null, null);
        changePoints = changePoints != null ? changePoints : new ChangePoints(null, null);
        recommendations = recommendations != null ? recommendations : new Recommendations(null);
    }

    public static CostPilotProperties defaults() {
        return new CostPilotProperties(null, null, null, null, null);
    }

    public record Analysis(Integer defaultDaysBack, Integer defaultForecastDays) {
        public Analysis {
            defaultDaysBack = defaultDaysBack != null ? defaultDaysBack : 90;
            defaultForecastDays = defaultForecastDays != null ? defaultForecastDays : 30;
            if (defaultDaysBack <= 0) {
                throw new IllegalArgumentException("defaultDaysBack must be positive");
            }
            if (defaultForecastDays <= 0) {
                throw new IllegalArgumentException("defaultForecastDays must be positive");
            }
        }
    }

    public record Forecasting(Double smoothingAlpha) {
        public Forecasting {
            smoothingAlpha = smoothingAlpha != null ? smoothingAlpha : 0.3d;
            if (smoothingAlpha <= 0 || smoothingAlpha > 1) {
                throw new IllegalArgumentException("smoothingAlpha must be within (0, 1]");
            }
        }
    }

    public record AnomalyDetection(
            Double zScoreThreshold,
            Double iqrMultiplier,
            Double rollingDeviationMultiplier,
            Double weekdayDeviationMultiplier,
            Integer maxReported
    ) {
        public AnomalyDetection {
            zScoreThreshold = zScoreThreshold != null ? zScoreThreshold : 2.5d;
            iqrMultiplier = iqrMultiplier != null ? iqrMultiplier : 1.5d;
            rollingDeviationMultiplier = rollingDeviationMultiplier != null ? rollingDeviationMultiplier : 2.0d;
            weekdayDeviationMultiplier = weekdayDeviationMultiplier != null ? weekdayDeviationMultiplier : 2.0d;
            maxReported = maxReported != null ? maxReported : 20;
            if (zScoreThreshold <= 0 || iqrMultiplier <= 0 || rollingDeviationMultiplier <= 0 || weekdayDeviationMultiplier <= 0) {
                throw new IllegalArgumentException("anomaly thresholds must be positive");
            }
            if (maxReported <= 0) {
                throw new IllegalArgumentException("maxReported must be positive");
            }
        }
    }

    public record ChangePoints(Double significanceThreshold, Integer maxReported) {
        public ChangePoints {
            significanceThreshold = significanceThreshold != null ? significanceThreshold : 1.5d;
            maxReported = maxReported != null ? maxReported : 10;
            if (significanceThreshold <= 0) {
                throw new IllegalArgumentException("significanceThreshold must be positive");
            }
            if (maxReported <= 0) {
                throw new IllegalArgumentException("maxReported must be positive");
            }
        }
    }

    public record Recommendations(Integer maxReturned) {
        public Recommendations {
            maxReturned = maxReturned != null ? maxReturned : 10;
            if (maxReturned <= 0) {
                throw new IllegalArgumentException("maxReturned must be positive");
            }
        }
    }
}
