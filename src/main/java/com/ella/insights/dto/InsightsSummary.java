package com.ella.insights.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InsightsSummary {
    int totalInsights;
    int trendsDetected;
    int anomaliesDetected;
    int forecastsGenerated;
    int opportunities;
    int monthsOfData;

    public static InsightsSummary empty() {
        return InsightsSummary.builder().build();
    }
}
