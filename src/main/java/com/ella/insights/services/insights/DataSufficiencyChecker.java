package com.ella.insights.services.insights;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import org.springframework.stereotype.Component;

import com.ella.insights.config.InsightsProperties;
import com.ella.insights.dto.DataSufficiencyResult;
import com.ella.insights.entities.LedgerTransaction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class DataSufficiencyChecker {

    private final InsightsProperties properties;

    /**
     * Requires a minimum number of sales plus purchases inside the analysed range and reports
     * how many calendar months they span.
     */
    public DataSufficiencyResult check(InsightDataCache cache) {
        List<? extends LedgerTransaction> sales = cache.getCurrentSales();
        List<? extends LedgerTransaction> purchases = cache.getCurrentPurchases();

        int totalTransactions = sales.size() + purchases.size();
        int minimum = properties.minimumTransactions();

        if (totalTransactions < minimum) {
            log.debug("Insufficient data for {}: {} of {} transactions", cache.getDateRange(), totalTransactions, minimum);
            return DataSufficiencyResult.insufficient(String.format(
                    "Need at least %d transactions for meaningful insights. Currently have %d.",
                    minimum,
                    totalTransactions
            ));
        }

        List<LocalDate> dates = Stream.concat(sales.stream(), purchases.stream())
                .map(LedgerTransaction::getDate)
                .toList();

        if (dates.isEmpty()) {
            return DataSufficiencyResult.insufficient("No transaction data available for the selected period.");
        }

        LocalDate min = dates.stream().min(Comparator.naturalOrder()).orElseThrow();
        LocalDate max = dates.stream().max(Comparator.naturalOrder()).orElseThrow();

        return DataSufficiencyResult.sufficient(monthsSpanned(min, max));
    }

    /**
     * Inclusive calendar-month difference, so two dates in the same month span one month.
     */
    static int monthsSpanned(LocalDate from, LocalDate to) {
        return (int) ChronoUnit.MONTHS.between(YearMonth.from(from), YearMonth.from(to)) + 1;
    }
}
