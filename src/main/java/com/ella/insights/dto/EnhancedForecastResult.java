package com.ella.insights.dto;

import java.math.BigDecimal;
import java.util.List;

import com.ella.insights.enums.ConfidenceLevel;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class EnhancedForecastResult {
    @Builder.Default
    List<BigDecimal> forecastedValues = List.of();
    @Builder.Default
    List<BigDecimal> lowerBounds = List.of();
    @Builder.Default
    List<BigDecimal> upperBounds = List.of();
    SeasonalPattern seasonalPattern;
    double confidenceScore;
    String methodUsed;
    int dataPointsUsed;
    int periodsForecasted;
    /** True when a sub-method failed and the result came from the remaining method. */
    boolean fallbackUsed;

    public BigDecimal getForecastedValue() {
        return forecastedValues.isEmpty() ? BigDecimal.ZERO : forecastedValues.get(0);
    }

    public ConfidenceLevel getConfidenceLevel() {
        return ConfidenceLevel.fromScore(confidenceScore);
    }
}
