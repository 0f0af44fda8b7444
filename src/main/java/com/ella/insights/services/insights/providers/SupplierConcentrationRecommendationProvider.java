package com.ella.insights.services.insights.providers;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ella.insights.dto.InsightItem;
import com.ella.insights.entities.Purchase;
import com.ella.insights.entities.Supplier;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.services.insights.InsightUtils;

@Component
@Order(40)
public class SupplierConcentrationRecommendationProvider implements RecommendationInsightProvider {

    private static final BigDecimal MAX_SHARE_PERCENT = BigDecimal.valueOf(60);
    private static final int MIN_SUPPLIERS = 2;

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        Map<String, BigDecimal> spendBySupplier = InsightUtils.totalsBy(
                cache.getCurrentPurchases(),
                (Purchase p) -> Objects.toString(p.getSupplierId(), ""));
        if (spendBySupplier.size() < MIN_SUPPLIERS) {
            return List.of();
        }

        BigDecimal total = spendBySupplier.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        Map.Entry<String, BigDecimal> top = spendBySupplier.entrySet().stream()
                .max(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .orElseThrow();

        BigDecimal share = InsightUtils.percentOf(top.getValue(), total);
        if (share.compareTo(MAX_SHARE_PERCENT) <= 0) {
            return List.of();
        }

        String supplierName = cache.getCompanyData().findSupplier(top.getKey())
                .map(Supplier::getName)
                .orElse("a single supplier");

        return List.of(InsightItem.builder()
                .title("Supplier Concentration Risk")
                .description(String.format(
                        "%s%% of your purchases (%s) are from %s.",
                        InsightUtils.formatPercent(share, 0),
                        InsightUtils.formatCurrency(top.getValue()),
                        supplierName
                ))
                .recommendation("Consider diversifying suppliers to reduce risk and potentially negotiate better terms.")
                .severity(InsightSeverity.INFO)
                .category(InsightCategory.RECOMMENDATION)
                .metricValue(top.getValue())
                .percentageChange(share)
                .build());
    }
}
