package com.ella.insights.dto;

import java.util.List;

import com.ella.insights.enums.TrendDirection;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SeasonalPattern {
    int seasonLength;
    @Builder.Default
    List<Double> seasonalFactors = List.of();
    /** 0 to 1, share of variance explained by the repeating cycle. */
    double seasonalStrength;
    @Builder.Default
    TrendDirection trendDirection = TrendDirection.STABLE;
    double trendSlope;
    String description;

    public static SeasonalPattern none(String description) {
        return SeasonalPattern.builder().description(description).build();
    }
}
