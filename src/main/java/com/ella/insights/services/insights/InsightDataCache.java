package com.ella.insights.services.insights;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.ella.insights.dto.AnalysisDateRange;
import com.ella.insights.entities.Purchase;
import com.ella.insights.entities.Sale;
import com.ella.insights.entities.SaleReturn;
import com.ella.insights.ledger.CompanyData;

/**
 * Per-analysis view over one {@link CompanyData} snapshot. Filtered slices are computed once
 * per date range and reused by every provider of the same run. Not shared between runs.
 */
public class InsightDataCache {

    private final CompanyData companyData;
    private final AnalysisDateRange dateRange;
    private final LocalDate today;
    private final Map<AnalysisDateRange, List<Sale>> salesByRange = new HashMap<>();
    private final Map<AnalysisDateRange, List<Purchase>> purchasesByRange = new HashMap<>();
    private final Map<AnalysisDateRange, List<SaleReturn>> returnsByRange = new HashMap<>();

    public InsightDataCache(CompanyData companyData, AnalysisDateRange dateRange, LocalDate today) {
        this.companyData = Objects.requireNonNull(companyData, "companyData");
        this.dateRange = Objects.requireNonNull(dateRange, "dateRange");
        this.today = Objects.requireNonNull(today, "today");
    }

    public CompanyData getCompanyData() {
        return companyData;
    }

    public AnalysisDateRange getDateRange() {
        return dateRange;
    }

    public LocalDate getToday() {
        return today;
    }

    public AnalysisDateRange getPreviousPeriod() {
        return dateRange.previousPeriod();
    }

    public List<Sale> getCurrentSales() {
        return getSales(dateRange);
    }

    public List<Purchase> getCurrentPurchases() {
        return getPurchases(dateRange);
    }

    /**
     * Sales dated within {@code range}, in chronological order.
     */
    public List<Sale> getSales(AnalysisDateRange range) {
        return salesByRange.computeIfAbsent(range, r -> safe(companyData.getSales()).stream()
                .filter(Objects::nonNull)
                .filter(s -> r.contains(s.getDate()))
                .sorted(Comparator.comparing(Sale::getDate))
                .toList());
    }

    public List<Purchase> getPurchases(AnalysisDateRange range) {
        return purchasesByRange.computeIfAbsent(range, r -> safe(companyData.getPurchases()).stream()
                .filter(Objects::nonNull)
                .filter(p -> r.contains(p.getDate()))
                .sorted(Comparator.comparing(Purchase::getDate))
                .toList());
    }

    public List<SaleReturn> getReturns(AnalysisDateRange range) {
        return returnsByRange.computeIfAbsent(range, r -> safe(companyData.getReturns()).stream()
                .filter(Objects::nonNull)
                .filter(ret -> r.contains(ret.getReturnDate()))
                .toList());
    }

    /**
     * Every sale with a date, regardless of range.
     */
    public List<Sale> getAllSales() {
        return safe(companyData.getSales()).stream()
                .filter(Objects::nonNull)
                .filter(s -> s.getDate() != null)
                .toList();
    }

    public List<Purchase> getAllPurchases() {
        return safe(companyData.getPurchases()).stream()
                .filter(Objects::nonNull)
                .filter(p -> p.getDate() != null)
                .toList();
    }

    private static <T> List<T> safe(List<T> values) {
        return values != null ? values : List.of();
    }
}
