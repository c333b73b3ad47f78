package com.costpilot.analytics.exception;

public class CostAnalyticsException extends RuntimeException {

    public CostAnalyticsException(String message) {
        super(message);
    }

    public CostAnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
