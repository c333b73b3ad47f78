package com.costpilot.analytics.model;

import com.costpilot.analytics.exception.AnalysisUnavailableException;
import java.util.Optional;

/**
 * Result of one analysis section: either a computed value or an explicit unavailability marker.
 * Exactly one of {@code value} and {@code unavailability} is non-null.
 */
public record Outcome<T>(T value, Unavailability unavailability) {

    public Outcome {
        if ((value == null) == (unavailability == null)) {
            throw new IllegalArgumentException("exactly one of value or unavailability must be provided");
        }
    }

    public static <T> Outcome<T> of(T value) {
        if (value == null) {
            throw new IllegalArgumentException("value must be provided");
        }
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> unavailable(Reason reason, String detail) {
        return new Outcome<>(null, new Unavailability(reason, detail));
    }

    public static <T> Outcome<T> unavailable(AnalysisUnavailableException cause) {
        return unavailable(cause.reason(), cause.getMessage());
    }

    public boolean isAvailable() {
        return value != null;
    }

    public Optional<T> asOptional() {
        return Optional.ofNullable(value);
    }

    public enum Reason {
        INSUFFICIENT_DATA,
        DEGENERATE_INPUT
    }

    public record Unavailability(Reason reason, String detail) {
        public Unavailability {
            if (reason == null) {
                throw new IllegalArgumentException("reason must be provided");
            }
            detail = detail == null ? "" : detail;
        }
    }
}
