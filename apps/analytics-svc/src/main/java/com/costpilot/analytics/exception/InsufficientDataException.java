package com.costpilot.analytics.exception;

import com.costpilot.analytics.model.Outcome;

public class InsufficientDataException extends AnalysisUnavailableException {

    private final String analysis;
    private final int required;
    private final int actual;

    public InsufficientDataException(String analysis, int required, int actual) {
        super("Insufficient data for " + analysis + ": requires at least " + required + " points, got " + actual);
        this.analysis = analysis;
        this.required = required;
        this.actual = actual;
    }

    @Override
    public Outcome.Reason reason() {
        return Outcome.Reason.INSUFFICIENT_DATA;
    }

    public String analysis() {
        return analysis;
    }

    public int required() {
        return required;
    }

    public int actual() {
        return actual;
    }
}
