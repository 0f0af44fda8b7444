package com.ella.insights.enums;

public enum AccuracyTrend {
    IMPROVING,
    STABLE,
    DECLINING
}
