package com.ella.insights.services.insights.providers;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ella.insights.config.InsightsProperties;
import com.ella.insights.dto.InsightItem;
import com.ella.insights.entities.Customer;
import com.ella.insights.entities.Sale;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.services.insights.InsightUtils;
import com.ella.insights.services.insights.InsightUtils.Statistics;

@Component
@Order(40)
public class LargeTransactionAnomalyProvider implements AnomalyInsightProvider {

    private static final int MIN_SALES = 5;
    private static final DateTimeFormatter SHORT_DATE = DateTimeFormatter.ofPattern("MMM d", Locale.US);

    private final InsightsProperties properties;

    public LargeTransactionAnomalyProvider(InsightsProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        List<Sale> sales = cache.getCurrentSales();
        if (sales.size() < MIN_SALES) {
            return List.of();
        }

        Statistics stats = InsightUtils.statistics(sales.stream()
                .map(s -> InsightUtils.safeAmount(s).doubleValue())
                .toList());

        Sale largest = sales.stream()
                .max(Comparator.comparing(InsightUtils::safeAmount))
                .orElseThrow();
        BigDecimal amount = InsightUtils.safeAmount(largest);

        OptionalDouble z = stats.zScore(amount.doubleValue());
        if (z.isEmpty() || z.getAsDouble() <= properties.largeTransactionZScore()) {
            return List.of();
        }

        String customerName = cache.getCompanyData().findCustomer(largest.getCustomerId())
                .map(Customer::getName)
                .orElse("a customer");

        return List.of(InsightItem.builder()
                .title("Unusually Large Transaction")
                .description(String.format(
                        "A sale of %s to %s on %s is significantly larger than your typical transaction size (%s).",
                        InsightUtils.formatCurrency(amount),
                        customerName,
                        largest.getDate().format(SHORT_DATE),
                        InsightUtils.formatCurrency(BigDecimal.valueOf(stats.mean()))
                ))
                .recommendation("Verify this transaction is correct and consider nurturing this high-value customer relationship.")
                .severity(InsightSeverity.INFO)
                .category(InsightCategory.ANOMALY)
                .metricValue(amount)
                .build());
    }
}
