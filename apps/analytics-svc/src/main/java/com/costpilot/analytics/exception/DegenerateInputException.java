package com.costpilot.analytics.exception;

import com.costpilot.analytics.model.Outcome;

public class DegenerateInputException extends AnalysisUnavailableException {

    private final String check;

    public DegenerateInputException(String check, String message) {
        super("[" + check + "] " + message);
        this.check = check;
    }

    @Override
    public Outcome.Reason reason() {
        return Outcome.Reason.DEGENERATE_INPUT;
    }

    public String check() {
        return check;
    }
}
