package com.ella.insights.services.insights.providers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ella.insights.dto.AnalysisDateRange;
import com.ella.insights.dto.InsightItem;
import com.ella.insights.entities.Product;
import com.ella.insights.entities.ReturnItem;
import com.ella.insights.entities.SaleReturn;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.services.insights.InsightUtils;

@Component
@Order(20)
public class ReturnRateAnomalyProvider implements AnomalyInsightProvider {

    private static final int MIN_SALES = 10;
    private static final int HISTORY_MONTHS = 6;
    private static final BigDecimal MAX_RATE_INCREASE_POINTS = BigDecimal.valueOf(3);

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        AnalysisDateRange range = cache.getDateRange();

        int currentSales = cache.getCurrentSales().size();
        if (currentSales < MIN_SALES) {
            return List.of();
        }
        List<SaleReturn> currentReturns = cache.getReturns(range);

        LocalDate historyStart = range.startDate().minusMonths(HISTORY_MONTHS);
        AnalysisDateRange history = AnalysisDateRange.of(historyStart, range.startDate().minusDays(1));
        int historicalSales = cache.getSales(history).size();
        if (historicalSales < MIN_SALES) {
            return List.of();
        }
        int historicalReturns = cache.getReturns(history).size();

        BigDecimal currentRate = rate(currentReturns.size(), currentSales);
        BigDecimal historicalRate = rate(historicalReturns, historicalSales);

        if (currentRate.compareTo(historicalRate.add(MAX_RATE_INCREASE_POINTS)) <= 0) {
            return List.of();
        }

        String productNote = mostReturnedProduct(currentReturns)
                .flatMap(cache.getCompanyData()::findProduct)
                .map(Product::getName)
                .map(name -> " Most returns are for: " + name + ".")
                .orElse("");

        return List.of(InsightItem.builder()
                .title("Return Rate Above Normal")
                .description(String.format(
                        "Current return rate is %s%% compared to historical average of %s%%.%s",
                        InsightUtils.formatPercent(currentRate, 1),
                        InsightUtils.formatPercent(historicalRate, 1),
                        productNote
                ))
                .recommendation("Investigate product quality, description accuracy, or shipping issues for affected items.")
                .severity(InsightSeverity.WARNING)
                .category(InsightCategory.ANOMALY)
                .metricValue(currentRate)
                .percentageChange(currentRate.subtract(historicalRate))
                .build());
    }

    private static BigDecimal rate(int returns, int sales) {
        if (sales == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(returns)
                .multiply(InsightUtils.HUNDRED)
                .divide(BigDecimal.valueOf(sales), 4, RoundingMode.HALF_UP);
    }

    private static Optional<String> mostReturnedProduct(List<SaleReturn> returns) {
        Map<String, Long> countByProduct = returns.stream()
                .filter(r -> r.getItems() != null)
                .flatMap(r -> r.getItems().stream())
                .filter(Objects::nonNull)
                .map(ReturnItem::getProductId)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(id -> id, Collectors.counting()));

        return countByProduct.entrySet().stream()
                .max(Map.Entry.<String, Long>comparingByValue()
                        .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey);
    }
}
