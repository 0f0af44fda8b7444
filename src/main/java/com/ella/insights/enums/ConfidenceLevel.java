package com.ella.insights.enums;

public enum ConfidenceLevel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String displayName;

    ConfidenceLevel(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Maps a 0-100 score: below 50 is low, 50 to 79 medium, 80 and above high.
     */
    public static ConfidenceLevel fromScore(double score) {
        if (score >= 80) {
            return HIGH;
        }
        if (score >= 50) {
            return MEDIUM;
        }
        return LOW;
    }
}
