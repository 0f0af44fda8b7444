package com.ella.insights.dto;

import java.time.LocalDateTime;
import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Result of a full analysis run. When {@link #hasSufficientData} is false every list is empty
 * and {@link #insufficientDataMessage} explains the shortfall.
 */
@Value
@Builder
public class InsightsData {
    boolean hasSufficientData;
    String insufficientDataMessage;
    @Builder.Default
    List<InsightItem> revenueTrends = List.of();
    @Builder.Default
    List<InsightItem> anomalies = List.of();
    @Builder.Default
    List<InsightItem> forecasts = List.of();
    @Builder.Default
    List<InsightItem> recommendations = List.of();
    ForecastData forecast;
    @Builder.Default
    InsightsSummary summary = InsightsSummary.empty();
    @EqualsAndHashCode.Exclude
    LocalDateTime generatedAt;
}
