package com.ella.insights.services.insights.providers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.ella.insights.dto.AnalysisDateRange;
import com.ella.insights.dto.InsightItem;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.ledger.InMemoryCompanyData;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.support.LedgerFixtures;

class ProfitMarginRecommendationProviderTest {

    private static final AnalysisDateRange MARCH = AnalysisDateRange.of(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 31));

    private final ProfitMarginRecommendationProvider provider = new ProfitMarginRecommendationProvider();

    @Test
    void lowMarginIsWarning() {
        List<InsightItem> out = provider.generate(cache("1000", "950"));

        assertEquals(1, out.size());
        assertEquals("Low Profit Margin Alert", out.get(0).getTitle());
        assertEquals(InsightSeverity.WARNING, out.get(0).getSeverity());
        assertEquals(InsightCategory.RECOMMENDATION, out.get(0).getCategory());
        assertTrue(out.get(0).getDescription().startsWith("Your current profit margin is 5.0%."));
    }

    @Test
    void strongMarginIsSuccess() {
        List<InsightItem> out = provider.generate(cache("1000", "600"));

        assertEquals(1, out.size());
        assertEquals("Strong Profit Margins", out.get(0).getTitle());
        assertEquals(InsightSeverity.SUCCESS, out.get(0).getSeverity());
    }

    @Test
    void ordinaryMarginIsQuiet() {
        assertTrue(provider.generate(cache("1000", "800")).isEmpty());
    }

    @Test
    void noRevenueIsQuiet() {
        InMemoryCompanyData data = InMemoryCompanyData.builder()
                .purchase(LedgerFixtures.purchase("p1", LocalDate.of(2025, 3, 5), "v1", "400"))
                .build();

        assertTrue(provider.generate(new InsightDataCache(data, MARCH, LocalDate.of(2025, 4, 1))).isEmpty());
    }

    private static InsightDataCache cache(String revenue, String expenses) {
        InMemoryCompanyData data = InMemoryCompanyData.builder()
                .sale(LedgerFixtures.sale("s1", LocalDate.of(2025, 3, 5), "c1", revenue))
                .purchase(LedgerFixtures.purchase("p1", LocalDate.of(2025, 3, 6), "v1", expenses))
                .build();
        return new InsightDataCache(data, MARCH, LocalDate.of(2025, 4, 1));
    }
}
