package com.ella.insights.dto;

import java.math.BigDecimal;

import com.ella.insights.enums.ConfidenceLevel;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ForecastData {
    @Builder.Default
    BigDecimal forecastedRevenue = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal forecastedExpenses = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal forecastedProfit = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal revenueGrowthPercent = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal expenseGrowthPercent = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal profitGrowthPercent = BigDecimal.ZERO;
    int expectedNewCustomers;
    @Builder.Default
    BigDecimal customerGrowthPercent = BigDecimal.ZERO;
    double confidenceScore;
    @Builder.Default
    ConfidenceLevel confidenceLevel = ConfidenceLevel.LOW;
    int dataMonthsUsed;

    String forecastMethod;
    BigDecimal revenueLowerBound;
    BigDecimal revenueUpperBound;
    SeasonalPattern seasonalPattern;
}
