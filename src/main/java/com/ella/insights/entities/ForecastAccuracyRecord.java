package com.ella.insights.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * A forecast stored by the ledger for a future period. The engine only reads these.
 */
@Getter
@AllArgsConstructor
@Builder
public class ForecastAccuracyRecord {

    private String id;

    private LocalDateTime forecastDate;

    private LocalDate periodStartDate;

    private LocalDate periodEndDate;

    @Builder.Default
    private BigDecimal forecastedRevenue = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal forecastedExpenses = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal forecastedProfit = BigDecimal.ZERO;

    private int forecastedNewCustomers;

    private double confidenceScore;

    private String forecastMethod;
}
