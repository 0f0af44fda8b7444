package com.ella.insights.services.insights.providers;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ella.insights.dto.InsightItem;
import com.ella.insights.entities.Customer;
import com.ella.insights.entities.Sale;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.services.insights.InsightUtils;

@Component
@Order(50)
public class CustomerConcentrationRecommendationProvider implements RecommendationInsightProvider {

    private static final BigDecimal MAX_SHARE_PERCENT = BigDecimal.valueOf(40);
    private static final int MIN_CUSTOMERS = 3;

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        Map<String, BigDecimal> revenueByCustomer = InsightUtils.totalsBy(
                cache.getCurrentSales(),
                (Sale s) -> Objects.toString(s.getCustomerId(), ""));
        if (revenueByCustomer.size() < MIN_CUSTOMERS) {
            return List.of();
        }

        BigDecimal total = revenueByCustomer.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (total.signum() == 0) {
            return List.of();
        }

        Map.Entry<String, BigDecimal> top = revenueByCustomer.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElseThrow();
        BigDecimal share = InsightUtils.percentOf(top.getValue(), total);
        if (share.compareTo(MAX_SHARE_PERCENT) <= 0) {
            return List.of();
        }

        String customerName = cache.getCompanyData().findCustomer(top.getKey())
                .map(Customer::getName)
                .orElse("your top customer");

        return List.of(InsightItem.builder()
                .title("Revenue Concentration Risk")
                .description(String.format(
                        "%s%% of revenue comes from %s. This creates business risk if that relationship changes.",
                        InsightUtils.formatPercent(share, 0),
                        customerName
                ))
                .recommendation("Work on diversifying your customer base through acquisition and marketing efforts.")
                .severity(InsightSeverity.WARNING)
                .category(InsightCategory.CUSTOMER)
                .metricValue(top.getValue())
                .percentageChange(share)
                .build());
    }
}
