package com.costpilot.analytics.exception;

public class UpstreamFailureException extends CostAnalyticsException {

    public UpstreamFailureException(String message) {
        super(message);
    }

    public UpstreamFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
