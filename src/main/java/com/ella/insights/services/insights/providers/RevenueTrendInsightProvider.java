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
@Order(10)
public class RevenueTrendInsightProvider implements TrendInsightProvider {

    private final InsightsProperties properties;

    public RevenueTrendInsightProvider(InsightsProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        BigDecimal currentRevenue = InsightUtils.sum(cache.getCurrentSales());
        BigDecimal previousRevenue = InsightUtils.sum(cache.getSales(cache.getPreviousPeriod()));

        // Without revenue in the previous period there is nothing to compare against
        if (previousRevenue.signum() <= 0) {
            return List.of();
        }

        BigDecimal change = InsightUtils.percentChange(previousRevenue, currentRevenue);
        if (change.abs().compareTo(properties.significantChangePercent()) < 0) {
            return List.of();
        }

        boolean growth = change.signum() > 0;
        return List.of(InsightItem.builder()
                .title(growth ? "Revenue Growth Detected" : "Revenue Decline Detected")
                .description(String.format(
                        "Your revenue has %s by %s%% compared to the previous period (%s → %s).",
                        growth ? "increased" : "decreased",
                        InsightUtils.formatPercent(change.abs(), 1),
                        InsightUtils.formatCurrency(previousRevenue),
                        InsightUtils.formatCurrency(currentRevenue)
                ))
                .recommendation(growth
                        ? "Consider analyzing which products or services drove this growth to replicate success."
                        : "Review recent changes that may have impacted revenue and consider promotional strategies.")
                .severity(growth ? InsightSeverity.SUCCESS : InsightSeverity.WARNING)
                .category(InsightCategory.REVENUE_TREND)
                .metricValue(currentRevenue)
                .percentageChange(change)
                .build());
    }
}
