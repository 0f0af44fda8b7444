package com.ella.insights.services.insights.providers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ella.insights.config.InsightsProperties;
import com.ella.insights.dto.AnalysisDateRange;
import com.ella.insights.dto.InsightItem;
import com.ella.insights.entities.Purchase;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.services.insights.InsightUtils;
import com.ella.insights.services.insights.InsightUtils.Statistics;

@Component
@Order(10)
public class ExpenseSpikeAnomalyProvider implements AnomalyInsightProvider {

    private static final int WEEKS_OF_HISTORY = 12;
    private static final int MIN_WEEKS = 4;

    private final InsightsProperties properties;

    public ExpenseSpikeAnomalyProvider(InsightsProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        LocalDate end = cache.getDateRange().endDate();

        List<Purchase> trailing = cache.getPurchases(AnalysisDateRange.of(end.minusDays(WEEKS_OF_HISTORY * 7L), end));
        List<BigDecimal> weeklyTotals = new ArrayList<>(InsightUtils.totalsBy(trailing, p -> InsightUtils.weekNumber(p.getDate())).values());

        BigDecimal currentWeek = InsightUtils.sum(cache.getPurchases(AnalysisDateRange.of(end.minusDays(7), end)));

        return evaluate(currentWeek, weeklyTotals).map(List::of).orElse(List.of());
    }

    /**
     * Flags {@code currentWeek} when its z-score against {@code weeklyTotals} exceeds the threshold.
     */
    public Optional<InsightItem> evaluate(BigDecimal currentWeek, List<BigDecimal> weeklyTotals) {
        if (weeklyTotals.size() < MIN_WEEKS) {
            return Optional.empty();
        }

        Statistics stats = InsightUtils.statistics(InsightUtils.toDoubles(weeklyTotals));
        OptionalDouble z = stats.zScore(currentWeek.doubleValue());
        if (z.isEmpty() || z.getAsDouble() <= properties.zScoreThreshold()) {
            return Optional.empty();
        }

        BigDecimal mean = BigDecimal.valueOf(stats.mean());
        BigDecimal percentAbove = InsightUtils.percentChange(mean, currentWeek);

        return Optional.of(InsightItem.builder()
                .title("Unusual Expense Spike Detected")
                .description(String.format(
                        "This week's expenses (%s) are %s%% above your typical weekly average (%s).",
                        InsightUtils.formatCurrency(currentWeek),
                        InsightUtils.formatPercent(percentAbove, 0),
                        InsightUtils.formatCurrency(mean)
                ))
                .recommendation("Review recent expense entries for any errors, unexpected costs, or one-time purchases.")
                .severity(InsightSeverity.WARNING)
                .category(InsightCategory.ANOMALY)
                .metricValue(currentWeek)
                .percentageChange(percentAbove)
                .build());
    }
}
