package com.costpilot.analytics.model;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE
}
