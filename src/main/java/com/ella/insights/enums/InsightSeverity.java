package com.ella.insights.enums;

public enum InsightSeverity {
    INFO("Info", "#3B82F6"),
    SUCCESS("Success", "#22C55E"),
    WARNING("Warning", "#F59E0B"),
    CRITICAL("Critical", "#EF4444");

    private final String displayName;
    private final String color;

    InsightSeverity(String displayName, String color) {
        this.displayName = displayName;
        this.color = color;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getColor() {
        return color;
    }
}
