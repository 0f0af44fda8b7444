package com.ella.insights.services.insights.providers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ella.insights.config.InsightsProperties;
import com.ella.insights.dto.AnalysisDateRange;
import com.ella.insights.dto.InsightItem;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.ledger.InMemoryCompanyData;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.support.LedgerFixtures;

class ExpenseSpikeAnomalyProviderTest {

    private final ExpenseSpikeAnomalyProvider provider = new ExpenseSpikeAnomalyProvider(InsightsProperties.defaults());

    @Test
    @DisplayName("Flags a week just over two standard deviations above the mean")
    void flagsSpikeAboveThreshold() {
        Optional<InsightItem> out = provider.evaluate(new BigDecimal("1201"), alternating());

        assertTrue(out.isPresent());
        InsightItem item = out.get();
        assertEquals("Unusual Expense Spike Detected", item.getTitle());
        assertEquals(InsightSeverity.WARNING, item.getSeverity());
        assertEquals(InsightCategory.ANOMALY, item.getCategory());
        assertEquals(0, item.getPercentageChange().compareTo(new BigDecimal("20.1")));
        assertTrue(item.getDescription().contains("$1,201"));
    }

    @Test
    void ignoresWeekJustUnderThreshold() {
        assertFalse(provider.evaluate(new BigDecimal("1199"), alternating()).isPresent());
    }

    @Test
    void needsFourWeeksOfHistory() {
        List<BigDecimal> weeks = List.of(new BigDecimal("100"), new BigDecimal("100"), new BigDecimal("100"));

        assertFalse(provider.evaluate(new BigDecimal("100000"), weeks).isPresent());
    }

    @Test
    @DisplayName("A flat history never produces a z-score")
    void flatHistory() {
        List<BigDecimal> weeks = List.of(new BigDecimal("500"), new BigDecimal("500"), new BigDecimal("500"),
                new BigDecimal("500"), new BigDecimal("500"));

        assertFalse(provider.evaluate(new BigDecimal("5000"), weeks).isPresent());
    }

    @Test
    void generateReadsPurchasesOfTheTrailingWeeks() {
        LocalDate end = LocalDate.of(2025, 6, 30);
        InMemoryCompanyData.InMemoryCompanyDataBuilder builder = InMemoryCompanyData.builder();
        for (int week = 11; week >= 2; week--) {
            builder.purchase(LedgerFixtures.purchase("p" + week, end.minusDays(week * 7L), "v1", "100"));
        }
        builder.purchase(LedgerFixtures.purchase("spike", end.minusDays(1), "v1", "5000"));

        InsightDataCache cache = new InsightDataCache(builder.build(),
                AnalysisDateRange.of(LocalDate.of(2025, 6, 1), end), end.plusDays(1));

        List<InsightItem> out = provider.generate(cache);

        assertEquals(1, out.size());
        assertEquals(0, out.get(0).getMetricValue().compareTo(new BigDecimal("5000")));
    }

    private static List<BigDecimal> alternating() {
        List<BigDecimal> weeks = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            weeks.add(new BigDecimal("900"));
            weeks.add(new BigDecimal("1100"));
        }
        return weeks;
    }
}
