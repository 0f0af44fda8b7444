package com.ella.insights.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ella.insights")
public record InsightsProperties(
        Integer minimumTransactions,
        BigDecimal significantChangePercent,
        BigDecimal volumeChangePercent,
        Double zScoreThreshold,
        Double largeTransactionZScore,
        Integer inactivityDays,
        Integer depletionDays,
        Double smoothingAlpha,
        Integer recentAccuracyRecords
) {
    public InsightsProperties {
        if (minimumTransactions == null) {
            minimumTransactions = 5;
        }
        if (significantChangePercent == null) {
            significantChangePercent = new BigDecimal("15");
        }
        if (volumeChangePercent == null) {
            volumeChangePercent = new BigDecimal("20");
        }
        if (zScoreThreshold == null) {
            zScoreThreshold = 2.0;
        }
        if (largeTransactionZScore == null) {
            largeTransactionZScore = 3.0;
        }
        if (inactivityDays == null) {
            inactivityDays = 60;
        }
        if (depletionDays == null) {
            depletionDays = 14;
        }
        if (smoothingAlpha == null) {
            smoothingAlpha = 0.3;
        }
        if (recentAccuracyRecords == null) {
            recentAccuracyRecords = 6;
        }
    }

    public static InsightsProperties defaults() {
        return new InsightsProperties(null, null, null, null, null, null, null, null, null);
    }
}
