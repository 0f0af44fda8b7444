package com.ella.insights.services.insights.providers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
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

@Component
@Order(30)
public class DayOfWeekInsightProvider implements TrendInsightProvider {

    private static final int MIN_SALES = 14;
    private static final BigDecimal ABOVE_AVERAGE_FACTOR = new BigDecimal("1.3");

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        List<Sale> sales = cache.getCurrentSales();
        if (sales.size() < MIN_SALES) {
            return List.of();
        }

        Map<DayOfWeek, BigDecimal> totalsByDay = InsightUtils.totalsBy(sales, s -> s.getDate().getDayOfWeek());
        if (totalsByDay.isEmpty()) {
            return List.of();
        }

        Map.Entry<DayOfWeek, BigDecimal> best = totalsByDay.entrySet().stream()
                .max(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .orElseThrow();

        BigDecimal average = totalsByDay.values().stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(totalsByDay.size()), 4, RoundingMode.HALF_UP);

        if (average.signum() <= 0 || best.getValue().compareTo(average.multiply(ABOVE_AVERAGE_FACTOR)) <= 0) {
            return List.of();
        }

        BigDecimal percentAbove = InsightUtils.percentChange(average, best.getValue());
        String day = best.getKey().getDisplayName(TextStyle.FULL, Locale.US);

        return List.of(InsightItem.builder()
                .title(day + " Sales Performance")
                .description(String.format(
                        "%ss generate %s%% more revenue than average daily sales (%s vs %s average).",
                        day,
                        InsightUtils.formatPercent(percentAbove, 0),
                        InsightUtils.formatCurrency(best.getValue()),
                        InsightUtils.formatCurrency(average)
                ))
                .recommendation(String.format(
                        "Consider running promotions or increasing staffing on %ss to maximize this opportunity.", day))
                .severity(InsightSeverity.INFO)
                .category(InsightCategory.REVENUE_TREND)
                .percentageChange(percentAbove)
                .build());
    }
}
