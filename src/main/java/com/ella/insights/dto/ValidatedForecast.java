package com.ella.insights.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.OptionalDouble;

import com.ella.insights.entities.ForecastAccuracyRecord;

/**
 * A stored forecast paired with the actuals observed for its period. Actuals are {@code null}
 * while the period has not ended.
 */
public record ValidatedForecast(
        ForecastAccuracyRecord forecast,
        BigDecimal actualRevenue,
        BigDecimal actualExpenses,
        BigDecimal actualProfit,
        Integer actualNewCustomers
) {

    public boolean validated() {
        return actualRevenue != null;
    }

    public OptionalDouble revenueAccuracyPercent() {
        return accuracy(forecast.getForecastedRevenue(), actualRevenue);
    }

    public OptionalDouble expensesAccuracyPercent() {
        return accuracy(forecast.getForecastedExpenses(), actualExpenses);
    }

    public OptionalDouble revenueMape() {
        if (actualRevenue == null || actualRevenue.signum() == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(absolutePercentError(forecast.getForecastedRevenue(), actualRevenue));
    }

    private static OptionalDouble accuracy(BigDecimal forecasted, BigDecimal actual) {
        if (actual == null || actual.signum() == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.max(0.0, 100.0 - absolutePercentError(forecasted, actual)));
    }

    private static double absolutePercentError(BigDecimal forecasted, BigDecimal actual) {
        BigDecimal safeForecast = forecasted != null ? forecasted : BigDecimal.ZERO;
        return safeForecast.subtract(actual).abs()
                .multiply(BigDecimal.valueOf(100))
                .divide(actual.abs(), 6, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
