package com.ella.insights.dto;

import java.util.List;

import com.ella.insights.enums.AccuracyTrend;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ForecastAccuracyData {
    @Builder.Default
    List<ValidatedForecast> records = List.of();
    int validatedCount;
    double averageRevenueAccuracy;
    double averageExpensesAccuracy;
    double overallRevenueMape;
    @Builder.Default
    AccuracyTrend accuracyTrend = AccuracyTrend.STABLE;
    String accuracyDescription;
}
