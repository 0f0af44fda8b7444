package com.ella.insights.services.forecasting;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.ella.insights.dto.AnalysisDateRange;
import com.ella.insights.dto.ForecastAccuracyData;
import com.ella.insights.dto.RecentAccuracy;
import com.ella.insights.dto.ValidatedForecast;
import com.ella.insights.entities.ForecastAccuracyRecord;
import com.ella.insights.entities.Purchase;
import com.ella.insights.entities.Sale;
import com.ella.insights.enums.AccuracyTrend;
import com.ella.insights.ledger.CompanyData;
import com.ella.insights.services.insights.InsightUtils;

import lombok.extern.slf4j.Slf4j;

/**
 * Compares stored forecasts with what the ledger actually recorded for their period.
 * Records are never modified; actuals are computed on every call.
 */
@Slf4j
@Service
public class ForecastAccuracyService {

    private static final int MIN_RECORDS_FOR_TREND = 4;
    private static final double TREND_MARGIN = 5.0;

    /**
     * Pairs each stored forecast with its actuals. Forecasts whose period has not ended by
     * {@code today} are returned unvalidated.
     */
    public List<ValidatedForecast> validate(CompanyData companyData, LocalDate today) {
        Objects.requireNonNull(companyData, "companyData");
        Objects.requireNonNull(today, "today");

        List<ForecastAccuracyRecord> records = safe(companyData.getForecastRecords());
        if (records.isEmpty()) {
            return List.of();
        }

        Map<String, LocalDate> firstPurchase = firstPurchaseByCustomer(safe(companyData.getSales()));

        return records.stream()
                .filter(Objects::nonNull)
                .filter(r -> r.getPeriodStartDate() != null && r.getPeriodEndDate() != null)
                .filter(ForecastAccuracyService::hasOrderedPeriod)
                .sorted(Comparator.comparing(ForecastAccuracyRecord::getPeriodStartDate).reversed())
                .map(r -> r.getPeriodEndDate().isBefore(today)
                        ? withActuals(companyData, r, firstPurchase)
                        : new ValidatedForecast(r, null, null, null, null))
                .toList();
    }

    public ForecastAccuracyData getAccuracyData(CompanyData companyData, LocalDate today) {
        List<ValidatedForecast> all = validate(companyData, today);
        List<ValidatedForecast> validated = all.stream().filter(ValidatedForecast::validated).toList();

        if (validated.isEmpty()) {
            return ForecastAccuracyData.builder()
                    .records(all)
                    .accuracyDescription("No validated forecasts yet. Check back after the current forecast period ends.")
                    .build();
        }

        List<Double> revenueAccuracies = values(validated, ValidatedForecast::revenueAccuracyPercent);
        List<Double> expenseAccuracies = values(validated, ValidatedForecast::expensesAccuracyPercent);
        List<Double> revenueMapes = values(validated, ValidatedForecast::revenueMape);

        double avgRevenue = average(revenueAccuracies);
        double avgExpenses = average(expenseAccuracies);

        // oldest first so the second half is the most recent
        List<Double> chronological = values(
                validated.stream()
                        .sorted(Comparator.comparing((ValidatedForecast v) -> v.forecast().getPeriodStartDate()))
                        .toList(),
                ValidatedForecast::revenueAccuracyPercent);

        return ForecastAccuracyData.builder()
                .records(all)
                .validatedCount(validated.size())
                .averageRevenueAccuracy(avgRevenue)
                .averageExpensesAccuracy(avgExpenses)
                .overallRevenueMape(average(revenueMapes))
                .accuracyTrend(trend(chronological))
                .accuracyDescription(describe((avgRevenue + avgExpenses) / 2))
                .build();
    }

    /**
     * Average accuracy of the {@code recentCount} most recently ended forecasts.
     */
    public Optional<RecentAccuracy> getRecentAccuracy(CompanyData companyData, LocalDate today, int recentCount) {
        List<ValidatedForecast> recent = validate(companyData, today).stream()
                .filter(ValidatedForecast::validated)
                .sorted(Comparator.comparing((ValidatedForecast v) -> v.forecast().getPeriodEndDate()).reversed())
                .limit(recentCount)
                .toList();
        if (recent.isEmpty()) {
            return Optional.empty();
        }

        List<Double> revenue = values(recent, ValidatedForecast::revenueAccuracyPercent);
        List<Double> expenses = values(recent, ValidatedForecast::expensesAccuracyPercent);
        if (revenue.isEmpty() && expenses.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RecentAccuracy(average(revenue), average(expenses)));
    }

    public String getAccuracySummary(CompanyData companyData, LocalDate today, int recentCount) {
        Optional<RecentAccuracy> recent = getRecentAccuracy(companyData, today, recentCount);
        if (recent.isEmpty()) {
            return "No validated forecasts yet. Check back after the current forecast period ends.";
        }
        long validatedCount = validate(companyData, today).stream().filter(ValidatedForecast::validated).count();
        double errorMargin = 100 - recent.get().average();
        return String.format("Based on %d validated forecast(s), predictions were within ±%.0f%% of actual values on average.",
                validatedCount, errorMargin);
    }

    static AccuracyTrend trend(List<Double> chronologicalAccuracies) {
        if (chronologicalAccuracies.size() < MIN_RECORDS_FOR_TREND) {
            return AccuracyTrend.STABLE;
        }
        int half = chronologicalAccuracies.size() / 2;
        double older = average(chronologicalAccuracies.subList(0, half));
        double newer = average(chronologicalAccuracies.subList(half, chronologicalAccuracies.size()));

        if (newer > older + TREND_MARGIN) {
            return AccuracyTrend.IMPROVING;
        }
        if (newer < older - TREND_MARGIN) {
            return AccuracyTrend.DECLINING;
        }
        return AccuracyTrend.STABLE;
    }

    static String describe(double overall) {
        double error = 100 - overall;
        if (overall >= 90) {
            return String.format("Excellent accuracy! Forecasts are within ±%.0f%% of actual values on average.", error);
        }
        if (overall >= 80) {
            return String.format("Good accuracy. Forecasts average ±%.0f%% deviation from actual values.", error);
        }
        if (overall >= 70) {
            return String.format("Moderate accuracy. Forecasts average ±%.0f%% deviation. Consider reviewing data patterns.", error);
        }
        return String.format("Low accuracy (±%.0f%% average error). More historical data may improve predictions.", error);
    }

    private static ValidatedForecast withActuals(CompanyData companyData, ForecastAccuracyRecord record,
                                                 Map<String, LocalDate> firstPurchase) {
        AnalysisDateRange period = AnalysisDateRange.of(record.getPeriodStartDate(), record.getPeriodEndDate());

        BigDecimal revenue = InsightUtils.sum(safe(companyData.getSales()).stream()
                .filter(Objects::nonNull)
                .filter(s -> period.contains(s.getDate()))
                .toList());
        BigDecimal expenses = InsightUtils.sum(safe(companyData.getPurchases()).stream()
                .filter(Objects::nonNull)
                .filter((Purchase p) -> period.contains(p.getDate()))
                .toList());
        int newCustomers = (int) firstPurchase.values().stream().filter(period::contains).count();

        log.debug("Forecast {} for {}: revenue {} vs actual {}", record.getId(), period,
                record.getForecastedRevenue(), revenue);
        return new ValidatedForecast(record, revenue, expenses, revenue.subtract(expenses), newCustomers);
    }

    private static boolean hasOrderedPeriod(ForecastAccuracyRecord record) {
        if (record.getPeriodStartDate().isAfter(record.getPeriodEndDate())) {
            log.debug("Skipping forecast {}: period starts {} after it ends {}",
                    record.getId(), record.getPeriodStartDate(), record.getPeriodEndDate());
            return false;
        }
        return true;
    }

    static Map<String, LocalDate> firstPurchaseByCustomer(List<Sale> sales) {
        return sales.stream()
                .filter(Objects::nonNull)
                .filter(s -> s.getCustomerId() != null && s.getDate() != null)
                .collect(Collectors.toMap(Sale::getCustomerId, Sale::getDate,
                        (a, b) -> a.isBefore(b) ? a : b));
    }

    private static List<Double> values(List<ValidatedForecast> forecasts,
                                       Function<ValidatedForecast, OptionalDouble> metric) {
        return forecasts.stream()
                .map(metric)
                .filter(OptionalDouble::isPresent)
                .map(OptionalDouble::getAsDouble)
                .toList();
    }

    private static double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static <T> List<T> safe(List<T> values) {
        return values != null ? values : List.of();
    }
}
