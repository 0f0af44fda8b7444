package com.ella.insights.services.insights.providers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ella.insights.dto.InsightItem;
import com.ella.insights.entities.LineItem;
import com.ella.insights.entities.Product;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.ledger.CompanyData;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.services.insights.InsightUtils;

import lombok.extern.slf4j.Slf4j;

/**
 * Highest-margin product of the period. Only products with a known cost take part.
 */
@Slf4j
@Component
@Order(10)
public class TopProductRecommendationProvider implements RecommendationInsightProvider {

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        CompanyData companyData = cache.getCompanyData();

        List<LineItem> lineItems = InsightUtils.productLineItems(cache.getCurrentSales());
        if (lineItems.isEmpty()) {
            return List.of();
        }

        Map<String, List<LineItem>> byProduct = InsightUtils.groupBy(lineItems, LineItem::getProductId);

        Optional<ProductMargin> top = byProduct.entrySet().stream()
                .map(e -> margin(companyData, e.getKey(), e.getValue()))
                .flatMap(Optional::stream)
                .max(Comparator.comparing(ProductMargin::marginPercent));
        if (top.isEmpty()) {
            return List.of();
        }

        ProductMargin best = top.get();
        String label = companyData.findProduct(best.productId())
                .map(Product::getName)
                .map(name -> "\"" + name + "\"")
                .orElse("Your top product");
        log.debug("Top margin product {} at {}%", best.productId(), best.marginPercent());

        return List.of(InsightItem.builder()
                .title("Top Performing Product")
                .description(String.format(
                        "%s has the highest profit margin at %s%%. Revenue this period: %s.",
                        label,
                        InsightUtils.formatPercent(best.marginPercent(), 0),
                        InsightUtils.formatCurrency(best.revenue())
                ))
                .recommendation("Consider featuring this product more prominently in marketing or bundling it with other items.")
                .severity(InsightSeverity.INFO)
                .category(InsightCategory.PRODUCT)
                .metricValue(best.revenue())
                .percentageChange(best.marginPercent())
                .build());
    }

    private static Optional<ProductMargin> margin(CompanyData companyData, String productId, List<LineItem> items) {
        BigDecimal unitCost = companyData.findProduct(productId)
                .map(Product::getCostPrice)
                .orElse(BigDecimal.ZERO);

        BigDecimal revenue = BigDecimal.ZERO;
        BigDecimal cost = BigDecimal.ZERO;
        for (LineItem item : items) {
            if (item.getQuantity() == null) {
                continue;
            }
            revenue = revenue.add(item.getAmount());
            cost = cost.add(item.getQuantity().multiply(unitCost));
        }

        if (cost.signum() <= 0 || revenue.signum() == 0) {
            return Optional.empty();
        }
        BigDecimal marginPercent = revenue.subtract(cost)
                .multiply(InsightUtils.HUNDRED)
                .divide(revenue, 4, RoundingMode.HALF_UP);
        return Optional.of(new ProductMargin(productId, revenue, marginPercent));
    }

    private record ProductMargin(String productId, BigDecimal revenue, BigDecimal marginPercent) {
    }
}
