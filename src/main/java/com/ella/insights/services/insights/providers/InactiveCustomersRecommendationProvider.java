package com.ella.insights.services.insights.providers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ella.insights.config.InsightsProperties;
import com.ella.insights.dto.InsightItem;
import com.ella.insights.entities.Sale;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.services.insights.InsightUtils;

import lombok.RequiredArgsConstructor;

@Component
@Order(20)
@RequiredArgsConstructor
public class InactiveCustomersRecommendationProvider implements RecommendationInsightProvider {

    private static final int MIN_PREVIOUS_PURCHASES = 2;

    private final InsightsProperties properties;

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        LocalDate end = cache.getDateRange().endDate();
        int threshold = properties.inactivityDays();

        List<Sale> withCustomer = cache.getAllSales().stream()
                .filter(s -> s.getCustomerId() != null)
                .toList();
        Map<String, List<Sale>> byCustomer = InsightUtils.groupBy(withCustomer, Sale::getCustomerId);

        long previouslyActive = byCustomer.values().stream()
                .filter(sales -> sales.size() >= MIN_PREVIOUS_PURCHASES)
                .map(sales -> sales.stream().map(Sale::getDate).max(Comparator.naturalOrder()).orElse(end))
                .filter(last -> ChronoUnit.DAYS.between(last, end) > threshold)
                .count();

        if (previouslyActive == 0) {
            return List.of();
        }

        return List.of(InsightItem.builder()
                .title("Customer Retention Opportunity")
                .description(String.format(
                        "%d previously active customer(s) haven't made a purchase in over %d days.",
                        previouslyActive,
                        threshold
                ))
                .recommendation("Consider sending re-engagement emails, special offers, or conducting a satisfaction survey.")
                .severity(InsightSeverity.INFO)
                .category(InsightCategory.CUSTOMER)
                .metricValue(BigDecimal.valueOf(previouslyActive))
                .build());
    }
}
