package com.ella.insights.services.insights.providers;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ella.insights.dto.InsightItem;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.services.insights.InsightUtils;

/**
 * Margin below 10% is a warning, above 30% a success. Anything in between is unremarkable.
 */
@Component
@Order(60)
public class ProfitMarginRecommendationProvider implements RecommendationInsightProvider {

    private static final BigDecimal LOW_MARGIN = BigDecimal.valueOf(10);
    private static final BigDecimal STRONG_MARGIN = BigDecimal.valueOf(30);

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        BigDecimal revenue = InsightUtils.sum(cache.getCurrentSales());
        if (revenue.signum() == 0) {
            return List.of();
        }
        BigDecimal expenses = InsightUtils.sum(cache.getCurrentPurchases());
        BigDecimal margin = InsightUtils.percentOf(revenue.subtract(expenses), revenue);

        if (margin.compareTo(LOW_MARGIN) < 0) {
            return List.of(InsightItem.builder()
                    .title("Low Profit Margin Alert")
                    .description(String.format(
                            "Your current profit margin is %s%%. Industry benchmarks typically suggest 15-20%% for healthy businesses.",
                            InsightUtils.formatPercent(margin, 1)
                    ))
                    .recommendation("Review pricing strategy and look for cost reduction opportunities to improve profitability.")
                    .severity(InsightSeverity.WARNING)
                    .category(InsightCategory.RECOMMENDATION)
                    .percentageChange(margin)
                    .build());
        }

        if (margin.compareTo(STRONG_MARGIN) > 0) {
            return List.of(InsightItem.builder()
                    .title("Strong Profit Margins")
                    .description(String.format(
                            "Your profit margin of %s%% is excellent. You're maintaining healthy profitability.",
                            InsightUtils.formatPercent(margin, 1)
                    ))
                    .severity(InsightSeverity.SUCCESS)
                    .category(InsightCategory.RECOMMENDATION)
                    .percentageChange(margin)
                    .build());
        }

        return List.of();
    }
}
