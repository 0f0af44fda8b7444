package com.ella.insights.enums;

public enum ForecastMethod {
    AUTO("Auto"),
    SSA("Singular Spectrum Analysis"),
    HOLT_WINTERS("Holt-Winters"),
    REGRESSION("Linear Regression + Exponential Smoothing"),
    COMBINED("Combined (SSA + Regression)");

    private final String displayName;

    ForecastMethod(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
