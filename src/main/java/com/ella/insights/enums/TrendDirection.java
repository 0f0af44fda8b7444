package com.ella.insights.enums;

public enum TrendDirection {
    INCREASING,
    STABLE,
    DECREASING;

    private static final double FLAT_SLOPE = 0.01;

    public static TrendDirection fromSlope(double slope) {
        if (slope > FLAT_SLOPE) {
            return INCREASING;
        }
        if (slope < -FLAT_SLOPE) {
            return DECREASING;
        }
        return STABLE;
    }
}
