package com.costpilot.analytics.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final CostPilotProperties props;

    public StartupDiagnostics(CostPilotProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var analysis = props.analysis();
        log.info("Analysis defaults: daysBack={}, forecastDays={}", analysis.defaultDaysBack(), analysis.defaultForecastDays());

        var anomaly = props.anomalyDetection();
        log.info("Anomaly detection: zScoreThreshold={}, iqrMultiplier={}, rollingMultiplier={}, weekdayMultiplier={}, maxReported={}",
                anomaly.zScoreThreshold(), anomaly.iqrMultiplier(), anomaly.rollingDeviationMultiplier(),
                anomaly.weekdayDeviationMultiplier(), anomaly.maxReported());

        log.info("Forecasting: smoothingAlpha={}; change points: threshold={}, maxReported={}; recommendations: maxReturned={}",
                props.forecasting().smoothingAlpha(), props.changePoints().significanceThreshold(),
                props.changePoints().maxReported(), props.recommendations().maxReturned());
    }
}
