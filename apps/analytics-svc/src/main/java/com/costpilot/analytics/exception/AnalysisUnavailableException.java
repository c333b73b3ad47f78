package com.costpilot.analytics.exception;

import com.costpilot.analytics.model.Outcome;

/**
 * Raised by an analysis step that cannot produce a value for the given series. Callers convert it
 * into an {@link Outcome.Unavailability} marker instead of propagating it.
 */
public abstract class AnalysisUnavailableException extends CostAnalyticsException {

    protected AnalysisUnavailableException(String message) {
        super(message);
    }

    public abstract Outcome.Reason reason();
}
