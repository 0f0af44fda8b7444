package com.ella.insights.services.insights.providers;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.Function;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ella.insights.config.InsightsProperties;
import com.ella.insights.dto.AnalysisDateRange;
import com.ella.insights.dto.InsightItem;
import com.ella.insights.entities.Sale;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.services.insights.InsightUtils;
import com.ella.insights.services.insights.InsightUtils.Statistics;

/**
 * Compares each bucket of the current period against a baseline three times as long.
 * Buckets are weeks for periods over 30 days, days otherwise. Only the first drop is reported.
 */
@Component
@Order(30)
public class RevenueDropAnomalyProvider implements AnomalyInsightProvider {

    private static final int BASELINE_MULTIPLIER = 3;
    private static final int MIN_BASELINE_POINTS = 5;
    private static final int WEEKLY_BUCKET_AFTER_DAYS = 30;

    private final InsightsProperties properties;

    public RevenueDropAnomalyProvider(InsightsProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        AnalysisDateRange range = cache.getDateRange();
        long periodDays = range.dayCount();
        boolean groupByWeek = periodDays > WEEKLY_BUCKET_AFTER_DAYS;
        Function<Sale, Integer> bucket = groupByWeek
                ? s -> InsightUtils.weekNumber(s.getDate())
                : s -> s.getDate().getDayOfYear();

        AnalysisDateRange baselineRange = AnalysisDateRange.of(
                range.startDate().minusDays(periodDays * BASELINE_MULTIPLIER),
                range.startDate().minusDays(1));

        Map<Integer, BigDecimal> baseline = InsightUtils.totalsBy(cache.getSales(baselineRange), bucket);
        if (baseline.size() < MIN_BASELINE_POINTS) {
            return List.of();
        }

        Statistics stats = InsightUtils.statistics(InsightUtils.toDoubles(baseline.values()));
        Map<Integer, BigDecimal> current = InsightUtils.totalsBy(cache.getCurrentSales(), bucket);

        for (BigDecimal total : current.values()) {
            OptionalDouble z = stats.zScore(total.doubleValue());
            if (z.isEmpty()) {
                return List.of();
            }
            if (z.getAsDouble() < -properties.zScoreThreshold()) {
                BigDecimal mean = BigDecimal.valueOf(stats.mean());
                BigDecimal percentBelow = InsightUtils.percentChange(mean, total).negate();

                return List.of(InsightItem.builder()
                        .title("Unusual Revenue Drop")
                        .description(String.format(
                                "Revenue for a recent period (%s) was %s%% below typical levels.",
                                InsightUtils.formatCurrency(total),
                                InsightUtils.formatPercent(percentBelow, 0)
                        ))
                        .recommendation("Check for any operational issues, competitor activity, or external factors that may have affected sales.")
                        .severity(InsightSeverity.CRITICAL)
                        .category(InsightCategory.ANOMALY)
                        .metricValue(total)
                        .percentageChange(percentBelow.negate())
                        .build());
            }
        }

        return List.of();
    }
}
