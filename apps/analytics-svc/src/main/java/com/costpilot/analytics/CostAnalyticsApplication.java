package com.costpilot.analytics;

import com.costpilot.analytics.config.CostPilotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CostPilotProperties.class)
public class CostAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostAnalyticsApplication.class, args);
    }
}
