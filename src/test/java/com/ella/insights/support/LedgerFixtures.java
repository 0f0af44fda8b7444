package com.ella.insights.support;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Executor;

import com.ella.insights.config.InsightsProperties;
import com.ella.insights.entities.LineItem;
import com.ella.insights.entities.Purchase;
import com.ella.insights.entities.Sale;
import com.ella.insights.services.forecasting.ForecastAccuracyService;
import com.ella.insights.services.forecasting.ForecastService;
import com.ella.insights.services.forecasting.HoltWintersForecaster;
import com.ella.insights.services.forecasting.LocalForecastingService;
import com.ella.insights.services.forecasting.SsaForecaster;
import com.ella.insights.services.forecasting.TrendForecaster;
import com.ella.insights.services.insights.AnomalyDetectionService;
import com.ella.insights.services.insights.DataSufficiencyChecker;
import com.ella.insights.services.insights.InsightsService;
import com.ella.insights.services.insights.RecommendationService;
import com.ella.insights.services.insights.TrendAnalysisService;
import com.ella.insights.services.insights.providers.CustomerConcentrationRecommendationProvider;
import com.ella.insights.services.insights.providers.DayOfWeekInsightProvider;
import com.ella.insights.services.insights.providers.ExpenseSpikeAnomalyProvider;
import com.ella.insights.services.insights.providers.ExpenseTrendInsightProvider;
import com.ella.insights.services.insights.providers.InactiveCustomersRecommendationProvider;
import com.ella.insights.services.insights.providers.LargeTransactionAnomalyProvider;
import com.ella.insights.services.insights.providers.OverdueInvoicesRecommendationProvider;
import com.ella.insights.services.insights.providers.ProfitMarginRecommendationProvider;
import com.ella.insights.services.insights.providers.ReturnRateAnomalyProvider;
import com.ella.insights.services.insights.providers.RevenueDropAnomalyProvider;
import com.ella.insights.services.insights.providers.RevenueTrendInsightProvider;
import com.ella.insights.services.insights.providers.SeasonalSalesInsightProvider;
import com.ella.insights.services.insights.providers.SupplierConcentrationRecommendationProvider;
import com.ella.insights.services.insights.providers.TopProductRecommendationProvider;
import com.ella.insights.services.insights.providers.TransactionVolumeInsightProvider;

/**
 * Builders for ledger rows and a fully wired engine with a fixed clock.
 */
public final class LedgerFixtures {

    private LedgerFixtures() {
    }

    public static Clock fixedClock(LocalDate today) {
        return Clock.fixed(today.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }

    public static Sale sale(String id, LocalDate date, String customerId, String amount) {
        return Sale.builder()
                .id(id)
                .date(date)
                .customerId(customerId)
                .effectiveTotalUsd(new BigDecimal(amount))
                .build();
    }

    public static Sale sale(String id, LocalDate date, String customerId, String amount, List<LineItem> lineItems) {
        return Sale.builder()
                .id(id)
                .date(date)
                .customerId(customerId)
                .effectiveTotalUsd(new BigDecimal(amount))
                .lineItems(lineItems)
                .build();
    }

    public static Purchase purchase(String id, LocalDate date, String supplierId, String amount) {
        return Purchase.builder()
                .id(id)
                .date(date)
                .supplierId(supplierId)
                .effectiveTotalUsd(new BigDecimal(amount))
                .build();
    }

    public static LineItem lineItem(String productId, String quantity, String unitPrice) {
        return LineItem.builder()
                .productId(productId)
                .quantity(new BigDecimal(quantity))
                .unitPrice(new BigDecimal(unitPrice))
                .build();
    }

    public static LocalForecastingService localForecastingService(InsightsProperties properties) {
        return new LocalForecastingService(new TrendForecaster(properties), new HoltWintersForecaster(), new SsaForecaster());
    }

    public static ForecastService forecastService(InsightsProperties properties) {
        return new ForecastService(properties, new TrendForecaster(properties),
                localForecastingService(properties), new ForecastAccuracyService());
    }

    public static InsightsService insightsService(Clock clock, Executor executor) {
        InsightsProperties properties = InsightsProperties.defaults();
        return new InsightsService(
                new DataSufficiencyChecker(properties),
                new TrendAnalysisService(List.of(
                        new RevenueTrendInsightProvider(properties),
                        new ExpenseTrendInsightProvider(properties),
                        new DayOfWeekInsightProvider(),
                        new SeasonalSalesInsightProvider(),
                        new TransactionVolumeInsightProvider(properties))),
                new AnomalyDetectionService(List.of(
                        new ExpenseSpikeAnomalyProvider(properties),
                        new ReturnRateAnomalyProvider(),
                        new RevenueDropAnomalyProvider(properties),
                        new LargeTransactionAnomalyProvider(properties))),
                new RecommendationService(List.of(
                        new TopProductRecommendationProvider(),
                        new InactiveCustomersRecommendationProvider(properties),
                        new OverdueInvoicesRecommendationProvider(),
                        new SupplierConcentrationRecommendationProvider(),
                        new CustomerConcentrationRecommendationProvider(),
                        new ProfitMarginRecommendationProvider())),
                forecastService(properties),
                clock,
                executor);
    }
}
