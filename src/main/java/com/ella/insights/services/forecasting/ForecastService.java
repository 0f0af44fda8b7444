package com.ella.insights.services.forecasting;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

import org.springframework.stereotype.Service;

import com.ella.insights.config.InsightsProperties;
import com.ella.insights.dto.AnalysisDateRange;
import com.ella.insights.dto.EnhancedForecastResult;
import com.ella.insights.dto.ForecastData;
import com.ella.insights.dto.InsightItem;
import com.ella.insights.dto.RecentAccuracy;
import com.ella.insights.dto.SeasonalPattern;
import com.ella.insights.entities.InventoryItem;
import com.ella.insights.entities.LedgerTransaction;
import com.ella.insights.entities.LineItem;
import com.ella.insights.entities.Product;
import com.ella.insights.enums.ConfidenceLevel;
import com.ella.insights.enums.ForecastMethod;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.ledger.CompanyData;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.services.insights.InsightUtils;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Next-month business forecast (revenue, expenses, profit and new customers) and the
 * forecast insights derived from it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {

    static final int TRAILING_MONTHS = 12;
    static final int MIN_MONTHS_FOR_FORECAST = 2;
    static final int VELOCITY_WINDOW_DAYS = 30;
    static final int MAX_LISTED_PRODUCTS = 3;

    private static final double NARROW_RANGE_CONFIDENCE = 70.0;

    private final InsightsProperties properties;
    private final TrendForecaster trendForecaster;
    private final LocalForecastingService localForecastingService;
    private final ForecastAccuracyService forecastAccuracyService;

    public ForecastData generateForecast(InsightDataCache cache) {
        LocalDate today = cache.getToday();
        LocalDate windowStart = today.minusMonths(TRAILING_MONTHS);

        List<BigDecimal> monthlyRevenue = monthlyTotals(trailing(cache.getAllSales(), windowStart));
        List<BigDecimal> monthlyExpenses = monthlyTotals(trailing(cache.getAllPurchases(), windowStart));

        BigDecimal forecastedRevenue = BigDecimal.ZERO;
        BigDecimal revenueGrowth = BigDecimal.ZERO;
        if (monthlyRevenue.size() >= MIN_MONTHS_FOR_FORECAST) {
            forecastedRevenue = trendForecaster.forecastNextPeriod(monthlyRevenue).max(BigDecimal.ZERO);
            revenueGrowth = growthAgainstLast(monthlyRevenue, forecastedRevenue);
        }

        BigDecimal forecastedExpenses = BigDecimal.ZERO;
        BigDecimal expenseGrowth = BigDecimal.ZERO;
        if (monthlyExpenses.size() >= MIN_MONTHS_FOR_FORECAST) {
            forecastedExpenses = trendForecaster.forecastNextPeriod(monthlyExpenses).max(BigDecimal.ZERO);
            expenseGrowth = growthAgainstLast(monthlyExpenses, forecastedExpenses);
        }

        BigDecimal forecastedProfit = forecastedRevenue.subtract(forecastedExpenses);
        BigDecimal currentProfit = last(monthlyRevenue).subtract(last(monthlyExpenses));
        BigDecimal profitGrowth = currentProfit.signum() != 0
                ? InsightUtils.percentChange(currentProfit, forecastedProfit)
                : BigDecimal.ZERO;

        List<BigDecimal> monthlyNewCustomers = monthlyNewCustomers(cache, windowStart);
        int expectedNewCustomers = 0;
        BigDecimal customerGrowth = BigDecimal.ZERO;
        if (monthlyNewCustomers.size() >= MIN_MONTHS_FOR_FORECAST) {
            expectedNewCustomers = Math.max(0, trendForecaster.forecastNextPeriod(monthlyNewCustomers)
                    .setScale(0, RoundingMode.HALF_UP)
                    .intValue());
            customerGrowth = growthAgainstLast(monthlyNewCustomers, BigDecimal.valueOf(expectedNewCustomers));
        }

        Double recentAccuracy = recentRevenueAccuracy(cache, today);

        double confidence = localForecastingService.calculateConfidenceScore(
                monthlyRevenue,
                localForecastingService.detectSeasonality(monthlyRevenue),
                recentAccuracy);

        ForecastData.ForecastDataBuilder builder = ForecastData.builder()
                .forecastedRevenue(forecastedRevenue)
                .forecastedExpenses(forecastedExpenses)
                .forecastedProfit(forecastedProfit)
                .revenueGrowthPercent(revenueGrowth)
                .expenseGrowthPercent(expenseGrowth)
                .profitGrowthPercent(profitGrowth)
                .expectedNewCustomers(expectedNewCustomers)
                .customerGrowthPercent(customerGrowth)
                .confidenceScore(confidence)
                .confidenceLevel(ConfidenceLevel.fromScore(confidence))
                .dataMonthsUsed(Math.max(monthlyRevenue.size(), monthlyExpenses.size()));

        List<BigDecimal> revenueHistory = monthlyTotals(cache.getAllSales());
        if (revenueHistory.size() >= MIN_MONTHS_FOR_FORECAST) {
            try {
                EnhancedForecastResult enhanced = localForecastingService.generateEnhancedForecast(
                        revenueHistory, 1, ForecastMethod.AUTO, recentAccuracy);
                builder.forecastMethod(enhanced.getMethodUsed())
                        .revenueLowerBound(first(enhanced.getLowerBounds()))
                        .revenueUpperBound(first(enhanced.getUpperBounds()))
                        .seasonalPattern(enhanced.getSeasonalPattern());
            } catch (RuntimeException e) {
                log.warn("[Forecast] enhanced revenue forecast failed, keeping the basic forecast: {}", e.getMessage(), e);
                builder.seasonalPattern(SeasonalPattern.none("Seasonal pattern could not be computed."));
            }
        } else {
            builder.seasonalPattern(SeasonalPattern.none("Insufficient data to detect seasonal patterns."));
        }

        ForecastData forecast = builder.build();
        log.debug("Forecast: revenue={} expenses={} confidence={} method={}",
                forecast.getForecastedRevenue(), forecast.getForecastedExpenses(),
                forecast.getConfidenceScore(), forecast.getForecastMethod());
        return forecast;
    }

    /**
     * Revenue range, cash-flow projection and inventory depletion alert. A rule that fails is
     * logged and contributes nothing.
     */
    public List<InsightItem> generateForecastInsights(InsightDataCache cache, ForecastData forecast) {
        List<InsightItem> insights = new ArrayList<>();
        failSoft("revenue range", () -> revenueRange(forecast)).ifPresent(insights::add);
        failSoft("cash flow", () -> cashFlow(forecast)).ifPresent(insights::add);
        failSoft("inventory depletion", () -> inventoryDepletion(cache)).ifPresent(insights::add);
        return List.copyOf(insights);
    }

    Optional<InsightItem> revenueRange(ForecastData forecast) {
        if (forecast.getForecastedRevenue().signum() <= 0) {
            return Optional.empty();
        }
        boolean narrow = forecast.getConfidenceScore() >= NARROW_RANGE_CONFIDENCE;
        BigDecimal low = forecast.getForecastedRevenue().multiply(new BigDecimal(narrow ? "0.9" : "0.8"));
        BigDecimal high = forecast.getForecastedRevenue().multiply(new BigDecimal(narrow ? "1.1" : "1.2"));

        return Optional.of(InsightItem.builder()
                .title("Next Month Revenue Forecast")
                .description(String.format(
                        "Based on %d months of historical data, expected revenue for next month is %s - %s (%s).",
                        forecast.getDataMonthsUsed(),
                        InsightUtils.formatCurrency(low),
                        InsightUtils.formatCurrency(high),
                        narrow ? "±10%" : "±20%"
                ))
                .severity(InsightSeverity.INFO)
                .category(InsightCategory.FORECAST)
                .metricValue(forecast.getForecastedRevenue())
                .build());
    }

    Optional<InsightItem> cashFlow(ForecastData forecast) {
        BigDecimal profit = forecast.getForecastedProfit();
        if (profit.signum() == 0) {
            return Optional.empty();
        }
        boolean positive = profit.signum() > 0;
        return Optional.of(InsightItem.builder()
                .title("Cash Flow Projection")
                .description(String.format(
                        "Projected cash flow for the next 30 days is %s. Expected %s: %s.",
                        positive ? "positive" : "negative",
                        positive ? "surplus" : "shortfall",
                        InsightUtils.formatCurrency(profit.abs())
                ))
                .severity(positive ? InsightSeverity.SUCCESS : InsightSeverity.WARNING)
                .category(InsightCategory.FORECAST)
                .metricValue(profit)
                .build());
    }

    /**
     * Products whose stock covers no more than the configured number of days at the
     * trailing 30-day sales velocity.
     */
    Optional<InsightItem> inventoryDepletion(InsightDataCache cache) {
        CompanyData companyData = cache.getCompanyData();
        List<InventoryItem> inventory = companyData.getInventory();
        if (inventory == null || inventory.isEmpty()) {
            return Optional.empty();
        }

        LocalDate end = cache.getDateRange().endDate();
        List<LineItem> recentItems = InsightUtils.productLineItems(
                cache.getSales(AnalysisDateRange.of(end.minusDays(VELOCITY_WINDOW_DAYS), end)));

        BigDecimal windowDays = BigDecimal.valueOf(VELOCITY_WINDOW_DAYS);
        BigDecimal depletionDays = BigDecimal.valueOf(properties.depletionDays());

        int atRisk = 0;
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, List<LineItem>> entry : InsightUtils.groupBy(recentItems, LineItem::getProductId).entrySet()) {
            BigDecimal sold = entry.getValue().stream()
                    .map(LineItem::getQuantity)
                    .filter(Objects::nonNull)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal dailyVelocity = sold.divide(windowDays, 6, RoundingMode.HALF_UP);
            if (dailyVelocity.signum() <= 0) {
                continue;
            }

            Optional<InventoryItem> stock = inventory.stream()
                    .filter(Objects::nonNull)
                    .filter(i -> entry.getKey().equals(i.getProductId()))
                    .findFirst();
            if (stock.isEmpty() || stock.get().getInStock() <= 0) {
                continue;
            }

            BigDecimal daysLeft = BigDecimal.valueOf(stock.get().getInStock()).divide(dailyVelocity, 4, RoundingMode.HALF_UP);
            if (daysLeft.compareTo(depletionDays) <= 0) {
                atRisk++;
                companyData.findProduct(entry.getKey()).map(Product::getName).ifPresent(names::add);
            }
        }

        if (atRisk == 0) {
            return Optional.empty();
        }

        String recommendation = names.isEmpty()
                ? "Review and place orders for low-stock items."
                : "Review and place orders for low-stock items: "
                        + String.join(", ", names.subList(0, Math.min(MAX_LISTED_PRODUCTS, names.size())));

        return Optional.of(InsightItem.builder()
                .title("Inventory Depletion Alert")
                .description(String.format(
                        "At current sales velocity, %d product(s) will reach reorder point within %d days.",
                        atRisk,
                        properties.depletionDays()
                ))
                .recommendation(recommendation)
                .severity(InsightSeverity.WARNING)
                .category(InsightCategory.INVENTORY)
                .metricValue(BigDecimal.valueOf(atRisk))
                .build());
    }

    /**
     * Totals per calendar month in chronological order. Months without transactions are absent.
     */
    static <T extends LedgerTransaction> List<BigDecimal> monthlyTotals(Collection<T> transactions) {
        Map<YearMonth, BigDecimal> totals = new TreeMap<>(InsightUtils.totalsBy(transactions, t -> YearMonth.from(t.getDate())));
        return List.copyOf(totals.values());
    }

    private List<BigDecimal> monthlyNewCustomers(InsightDataCache cache, LocalDate windowStart) {
        Map<YearMonth, Integer> counts = new TreeMap<>();
        ForecastAccuracyService.firstPurchaseByCustomer(cache.getAllSales()).values().stream()
                .filter(first -> !first.isBefore(windowStart))
                .forEach(first -> counts.merge(YearMonth.from(first), 1, Integer::sum));
        return counts.values().stream().map(count -> BigDecimal.valueOf(count.longValue())).toList();
    }

    private Double recentRevenueAccuracy(InsightDataCache cache, LocalDate today) {
        try {
            return forecastAccuracyService
                    .getRecentAccuracy(cache.getCompanyData(), today, properties.recentAccuracyRecords())
                    .map(RecentAccuracy::revenueAccuracy)
                    .orElse(null);
        } catch (RuntimeException e) {
            log.warn("[Forecast] forecast accuracy lookup failed, scoring without it: {}", e.getMessage(), e);
            return null;
        }
    }

    private static Optional<InsightItem> failSoft(String rule, Supplier<Optional<InsightItem>> insight) {
        try {
            return insight.get();
        } catch (RuntimeException e) {
            log.warn("[Forecast] {} insight failed: {}", rule, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private static <T extends LedgerTransaction> List<T> trailing(List<T> transactions, LocalDate windowStart) {
        return transactions.stream()
                .filter(t -> !t.getDate().isBefore(windowStart))
                .toList();
    }

    private static BigDecimal growthAgainstLast(List<BigDecimal> series, BigDecimal forecast) {
        BigDecimal lastValue = last(series);
        return lastValue.signum() > 0 ? InsightUtils.percentChange(lastValue, forecast) : BigDecimal.ZERO;
    }

    private static BigDecimal last(List<BigDecimal> series) {
        return series.isEmpty() ? BigDecimal.ZERO : series.get(series.size() - 1);
    }

    private static BigDecimal first(List<BigDecimal> values) {
        return values.isEmpty() ? null : values.get(0);
    }
}
