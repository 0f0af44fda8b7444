package com.ella.insights.services.insights.providers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ella.insights.config.InsightsProperties;
import com.ella.insights.dto.AnalysisDateRange;
import com.ella.insights.dto.InsightItem;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.ledger.InMemoryCompanyData;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.support.LedgerFixtures;

class RevenueDropAnomalyProviderTest {

    private static final AnalysisDateRange WEEK = AnalysisDateRange.of(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 7));

    private final RevenueDropAnomalyProvider provider = new RevenueDropAnomalyProvider(InsightsProperties.defaults());

    @Test
    @DisplayName("A day four standard deviations below the daily baseline is critical")
    void flagsDailyDrop() {
        InMemoryCompanyData data = baseline()
                .sale(LedgerFixtures.sale("now1", LocalDate.of(2025, 3, 1), "c1", "1100"))
                .sale(LedgerFixtures.sale("now2", LocalDate.of(2025, 3, 2), "c1", "700"))
                .sale(LedgerFixtures.sale("now3", LocalDate.of(2025, 3, 3), "c1", "600"))
                .build();

        List<InsightItem> out = provider.generate(new InsightDataCache(data, WEEK, LocalDate.of(2025, 3, 8)));

        assertEquals(1, out.size());
        InsightItem item = out.get(0);
        assertEquals("Unusual Revenue Drop", item.getTitle());
        assertEquals(InsightSeverity.CRITICAL, item.getSeverity());
        // only the first dropping day is reported
        assertEquals(0, item.getMetricValue().compareTo(new BigDecimal("700")));
        assertTrue(item.getDescription().contains("36% below typical levels"), item.getDescription());
    }

    @Test
    void normalDaysAreIgnored() {
        InMemoryCompanyData data = baseline()
                .sale(LedgerFixtures.sale("now1", LocalDate.of(2025, 3, 1), "c1", "1050"))
                .build();

        assertTrue(provider.generate(new InsightDataCache(data, WEEK, LocalDate.of(2025, 3, 8))).isEmpty());
    }

    @Test
    void needsFiveBaselineBuckets() {
        InMemoryCompanyData data = InMemoryCompanyData.builder()
                .sale(LedgerFixtures.sale("b1", LocalDate.of(2025, 2, 20), "c1", "1000"))
                .sale(LedgerFixtures.sale("b2", LocalDate.of(2025, 2, 21), "c1", "1200"))
                .sale(LedgerFixtures.sale("now1", LocalDate.of(2025, 3, 1), "c1", "1"))
                .build();

        assertTrue(provider.generate(new InsightDataCache(data, WEEK, LocalDate.of(2025, 3, 8))).isEmpty());
    }

    @Test
    void flatBaselineProducesNothing() {
        InMemoryCompanyData.InMemoryCompanyDataBuilder builder = InMemoryCompanyData.builder();
        for (int day = 10; day <= 20; day++) {
            builder.sale(LedgerFixtures.sale("b" + day, LocalDate.of(2025, 2, day), "c1", "1000"));
        }
        builder.sale(LedgerFixtures.sale("now1", LocalDate.of(2025, 3, 1), "c1", "1"));

        assertTrue(provider.generate(new InsightDataCache(builder.build(), WEEK, LocalDate.of(2025, 3, 8))).isEmpty());
    }

    /**
     * Daily sales alternating 1000 and 1200 from Feb 8 to Feb 27: mean 1100, deviation 100.
     */
    private static InMemoryCompanyData.InMemoryCompanyDataBuilder baseline() {
        InMemoryCompanyData.InMemoryCompanyDataBuilder builder = InMemoryCompanyData.builder();
        for (int day = 8; day <= 27; day++) {
            String amount = day % 2 == 0 ? "1000" : "1200";
            builder.sale(LedgerFixtures.sale("b" + day, LocalDate.of(2025, 2, day), "c1", amount));
        }
        return builder;
    }
}
