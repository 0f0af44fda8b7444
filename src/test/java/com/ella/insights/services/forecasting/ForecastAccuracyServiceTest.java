package com.ella.insights.services.forecasting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ella.insights.dto.ForecastAccuracyData;
import com.ella.insights.dto.RecentAccuracy;
import com.ella.insights.dto.ValidatedForecast;
import com.ella.insights.entities.ForecastAccuracyRecord;
import com.ella.insights.enums.AccuracyTrend;
import com.ella.insights.ledger.InMemoryCompanyData;
import com.ella.insights.support.LedgerFixtures;

class ForecastAccuracyServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 4, 1);

    private final ForecastAccuracyService service = new ForecastAccuracyService();

    @Test
    @DisplayName("Ended periods are paired with actuals, newest first")
    void validatesEndedPeriods() {
        List<ValidatedForecast> out = service.validate(ledger(), TODAY);

        assertEquals(3, out.size());
        assertEquals("jul", out.get(0).forecast().getId());
        assertFalse(out.get(0).validated());
        assertNull(out.get(0).actualRevenue());

        ValidatedForecast january = out.get(2);
        assertEquals("jan", january.forecast().getId());
        assertEquals(0, january.actualRevenue().compareTo(new BigDecimal("1000")));
        assertEquals(0, january.actualExpenses().compareTo(new BigDecimal("500")));
        assertEquals(0, january.actualProfit().compareTo(new BigDecimal("500")));
        assertEquals(1, january.actualNewCustomers());
        assertEquals(90.0, january.revenueAccuracyPercent().getAsDouble(), 1e-9);
        assertEquals(100.0, january.expensesAccuracyPercent().getAsDouble(), 1e-9);
        assertEquals(10.0, january.revenueMape().getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("A stored forecast whose period ends before it starts is skipped")
    void skipsReversedPeriods() {
        InMemoryCompanyData data = InMemoryCompanyData.builder()
                .sale(LedgerFixtures.sale("s1", LocalDate.of(2025, 1, 5), "c1", "1000"))
                .forecastRecord(record("jan", LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31), "900", "0"))
                .forecastRecord(record("bad", LocalDate.of(2025, 3, 31), LocalDate.of(2025, 3, 1), "500", "0"))
                .build();

        List<ValidatedForecast> out = service.validate(data, TODAY);

        assertEquals(1, out.size());
        assertEquals("jan", out.get(0).forecast().getId());
        assertEquals(1, service.getAccuracyData(data, TODAY).getValidatedCount());
    }

    @Test
    void aggregatesAccuracyStatistics() {
        ForecastAccuracyData data = service.getAccuracyData(ledger(), TODAY);

        assertEquals(3, data.getRecords().size());
        assertEquals(2, data.getValidatedCount());
        assertEquals(80.0, data.getAverageRevenueAccuracy(), 1e-9);
        assertEquals(90.0, data.getAverageExpensesAccuracy(), 1e-9);
        assertEquals(20.0, data.getOverallRevenueMape(), 1e-9);
        assertEquals(AccuracyTrend.STABLE, data.getAccuracyTrend());
        assertEquals("Good accuracy. Forecasts average ±15% deviation from actual values.", data.getAccuracyDescription());
    }

    @Test
    void recentAccuracyAndSummary() {
        Optional<RecentAccuracy> recent = service.getRecentAccuracy(ledger(), TODAY, 6);

        assertTrue(recent.isPresent());
        assertEquals(80.0, recent.get().revenueAccuracy(), 1e-9);
        assertEquals(90.0, recent.get().expenseAccuracy(), 1e-9);
        assertEquals("Based on 2 validated forecast(s), predictions were within ±15% of actual values on average.",
                service.getAccuracySummary(ledger(), TODAY, 6));
    }

    @Test
    void recentAccuracyLimitsToMostRecentlyEnded() {
        Optional<RecentAccuracy> recent = service.getRecentAccuracy(ledger(), TODAY, 1);

        assertEquals(70.0, recent.orElseThrow().revenueAccuracy(), 1e-9);
    }

    @Test
    @DisplayName("A period ending today is not validated yet")
    void periodEndingTodayIsPending() {
        InMemoryCompanyData data = InMemoryCompanyData.builder()
                .forecastRecord(record("mar", LocalDate.of(2025, 3, 1), LocalDate.of(2025, 4, 1), "1000", "500"))
                .build();

        assertFalse(service.validate(data, TODAY).get(0).validated());
        assertTrue(service.getRecentAccuracy(data, TODAY, 6).isEmpty());
        assertEquals("No validated forecasts yet. Check back after the current forecast period ends.",
                service.getAccuracySummary(data, TODAY, 6));
        assertEquals(0, service.getAccuracyData(data, TODAY).getValidatedCount());
    }

    @Test
    void zeroActualsHaveNoAccuracy() {
        InMemoryCompanyData data = InMemoryCompanyData.builder()
                .forecastRecord(record("feb", LocalDate.of(2025, 2, 1), LocalDate.of(2025, 2, 28), "1000", "500"))
                .build();

        ValidatedForecast validated = service.validate(data, TODAY).get(0);

        assertTrue(validated.validated());
        assertTrue(validated.revenueAccuracyPercent().isEmpty());
        assertTrue(validated.revenueMape().isEmpty());
        assertTrue(service.getRecentAccuracy(data, TODAY, 6).isEmpty());
    }

    @Test
    void trendComparesOlderAndNewerHalves() {
        assertEquals(AccuracyTrend.IMPROVING, ForecastAccuracyService.trend(List.of(60.0, 62.0, 80.0, 85.0)));
        assertEquals(AccuracyTrend.DECLINING, ForecastAccuracyService.trend(List.of(90.0, 90.0, 70.0, 70.0)));
        assertEquals(AccuracyTrend.STABLE, ForecastAccuracyService.trend(List.of(80.0, 82.0, 84.0, 83.0)));
        assertEquals(AccuracyTrend.STABLE, ForecastAccuracyService.trend(List.of(10.0, 90.0, 95.0)));
    }

    @Test
    void describesAccuracyBands() {
        assertEquals("Excellent accuracy! Forecasts are within ±5% of actual values on average.",
                ForecastAccuracyService.describe(95));
        assertEquals("Moderate accuracy. Forecasts average ±25% deviation. Consider reviewing data patterns.",
                ForecastAccuracyService.describe(75));
        assertEquals("Low accuracy (±50% average error). More historical data may improve predictions.",
                ForecastAccuracyService.describe(50));
    }

    @Test
    void firstPurchaseIsTheEarliestSale() {
        Map<String, LocalDate> first = ForecastAccuracyService.firstPurchaseByCustomer(List.of(
                LedgerFixtures.sale("s1", LocalDate.of(2025, 2, 1), "c1", "10"),
                LedgerFixtures.sale("s2", LocalDate.of(2025, 1, 1), "c1", "10"),
                LedgerFixtures.sale("s3", LocalDate.of(2025, 1, 5), null, "10")));

        assertEquals(Map.of("c1", LocalDate.of(2025, 1, 1)), first);
    }

    /**
     * January: forecast 900/500 against 1000/500. February: forecast 1300/400 against 1000/500.
     * July has not happened yet.
     */
    private static InMemoryCompanyData ledger() {
        return InMemoryCompanyData.builder()
                .sale(LedgerFixtures.sale("s0", LocalDate.of(2024, 12, 10), "c2", "500"))
                .sale(LedgerFixtures.sale("s1", LocalDate.of(2025, 1, 5), "c1", "600"))
                .sale(LedgerFixtures.sale("s2", LocalDate.of(2025, 1, 20), "c2", "400"))
                .sale(LedgerFixtures.sale("s3", LocalDate.of(2025, 2, 10), "c1", "1000"))
                .purchase(LedgerFixtures.purchase("p1", LocalDate.of(2025, 1, 15), "v1", "500"))
                .purchase(LedgerFixtures.purchase("p2", LocalDate.of(2025, 2, 15), "v1", "500"))
                .forecastRecord(record("jan", LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31), "900", "500"))
                .forecastRecord(record("feb", LocalDate.of(2025, 2, 1), LocalDate.of(2025, 2, 28), "1300", "400"))
                .forecastRecord(record("jul", LocalDate.of(2025, 7, 1), LocalDate.of(2025, 7, 31), "2000", "800"))
                .build();
    }

    private static ForecastAccuracyRecord record(String id, LocalDate start, LocalDate end, String revenue, String expenses) {
        return ForecastAccuracyRecord.builder()
                .id(id)
                .periodStartDate(start)
                .periodEndDate(end)
                .forecastedRevenue(new BigDecimal(revenue))
                .forecastedExpenses(new BigDecimal(expenses))
                .build();
    }
}
