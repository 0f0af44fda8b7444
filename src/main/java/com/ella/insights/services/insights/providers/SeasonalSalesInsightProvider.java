package com.ella.insights.services.insights.providers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ella.insights.dto.InsightItem;
import com.ella.insights.entities.Sale;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.services.insights.InsightUtils;

/**
 * Looks for a calendar month that clearly outsells the others over the trailing year.
 */
@Component
@Order(40)
public class SeasonalSalesInsightProvider implements TrendInsightProvider {

    private static final int MIN_MONTHS = 6;
    private static final BigDecimal ABOVE_AVERAGE_FACTOR = new BigDecimal("1.25");

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        LocalDate windowStart = cache.getToday().minusMonths(12);
        List<Sale> trailingYear = cache.getAllSales().stream()
                .filter(s -> !s.getDate().isBefore(windowStart))
                .toList();

        Map<Month, BigDecimal> totalsByMonth = InsightUtils.totalsBy(trailingYear, s -> s.getDate().getMonth());
        if (totalsByMonth.size() < MIN_MONTHS) {
            return List.of();
        }

        Map.Entry<Month, BigDecimal> best = totalsByMonth.entrySet().stream()
                .max(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .orElseThrow();

        BigDecimal average = totalsByMonth.values().stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(totalsByMonth.size()), 4, RoundingMode.HALF_UP);

        if (average.signum() <= 0 || best.getValue().compareTo(average.multiply(ABOVE_AVERAGE_FACTOR)) <= 0) {
            return List.of();
        }

        String monthName = best.getKey().getDisplayName(TextStyle.FULL, Locale.US);
        BigDecimal percentAbove = InsightUtils.percentChange(average, best.getValue());

        return List.of(InsightItem.builder()
                .title("Seasonal Pattern Identified")
                .description(String.format(
                        "Historical data shows %s generates %s%% more revenue than average months.",
                        monthName,
                        InsightUtils.formatPercent(percentAbove, 0)
                ))
                .recommendation(String.format(
                        "Plan inventory and marketing campaigns ahead of %s to capitalize on this seasonal trend.",
                        monthName))
                .severity(InsightSeverity.INFO)
                .category(InsightCategory.REVENUE_TREND)
                .percentageChange(percentAbove)
                .build());
    }
}
