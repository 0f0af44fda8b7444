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
@Order(50)
public class TransactionVolumeInsightProvider implements TrendInsightProvider {

    private final InsightsProperties properties;

    public TransactionVolumeInsightProvider(InsightsProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        int currentCount = cache.getCurrentSales().size();
        int previousCount = cache.getSales(cache.getPreviousPeriod()).size();

        if (previousCount == 0) {
            return List.of();
        }

        BigDecimal change = InsightUtils.percentChange(previousCount, currentCount);
        if (change.abs().compareTo(properties.volumeChangePercent()) < 0) {
            return List.of();
        }

        boolean increased = change.signum() > 0;
        return List.of(InsightItem.builder()
                .title(increased ? "Transaction Volume Increasing" : "Transaction Volume Declining")
                .description(String.format(
                        "Number of transactions has %s by %s%% (%d → %d transactions).",
                        increased ? "increased" : "decreased",
                        InsightUtils.formatPercent(change.abs(), 0),
                        previousCount,
                        currentCount
                ))
                .recommendation(increased
                        ? "Ensure operational capacity can handle increased demand."
                        : "Consider outreach campaigns to re-engage customers.")
                .severity(increased ? InsightSeverity.SUCCESS : InsightSeverity.WARNING)
                .category(InsightCategory.REVENUE_TREND)
                .metricValue(BigDecimal.valueOf(currentCount))
                .percentageChange(change)
                .build());
    }
}
