package com.ella.insights.services.insights.providers;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ella.insights.config.InsightsProperties;
import com.ella.insights.dto.InsightItem;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.services.insights.InsightUtils;

@Component
@Order(20)
public class ExpenseTrendInsightProvider implements TrendInsightProvider {

    private final InsightsProperties properties;

    public ExpenseTrendInsightProvider(InsightsProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        BigDecimal currentExpenses = InsightUtils.sum(cache.getCurrentPurchases());
        BigDecimal previousExpenses = InsightUtils.sum(cache.getPurchases(cache.getPreviousPeriod()));

        if (previousExpenses.signum() <= 0) {
            return List.of();
        }

        BigDecimal change = InsightUtils.percentChange(previousExpenses, currentExpenses);
        if (change.abs().compareTo(properties.significantChangePercent()) < 0) {
            return List.of();
        }

        boolean increased = change.signum() > 0;
        return List.of(InsightItem.builder()
                .title(increased ? "Expense Increase Detected" : "Expense Reduction Achieved")
                .description(String.format(
                        "Your expenses have %s by %s%% compared to the previous period (%s → %s).",
                        increased ? "increased" : "decreased",
                        InsightUtils.formatPercent(change.abs(), 1),
                        InsightUtils.formatCurrency(previousExpenses),
                        InsightUtils.formatCurrency(currentExpenses)
                ))
                .recommendation(increased
                        ? "Review expense categories to identify areas where costs can be optimized."
                        : "Good job on cost management! Document what strategies worked for future reference.")
                .severity(increased ? InsightSeverity.WARNING : InsightSeverity.SUCCESS)
                .category(InsightCategory.EXPENSE_TREND)
                .metricValue(currentExpenses)
                .percentageChange(change)
                .build());
    }
}
