package com.ella.insights.services.insights;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.Function;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import com.ella.insights.entities.LedgerTransaction;
import com.ella.insights.entities.LineItem;
import com.ella.insights.entities.Sale;

public final class InsightUtils {

    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final int PERCENT_SCALE = 4;

    private InsightUtils() {
    }

    public static BigDecimal safeAmount(LedgerTransaction transaction) {
        if (transaction == null || transaction.getEffectiveTotalUsd() == null) {
            return BigDecimal.ZERO;
        }
        return transaction.getEffectiveTotalUsd();
    }

    public static BigDecimal sum(Collection<? extends LedgerTransaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return BigDecimal.ZERO;
        }
        return transactions.stream()
                .filter(Objects::nonNull)
                .map(InsightUtils::safeAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * {@code (newValue - oldValue) / |oldValue| * 100}. A zero base yields 100 when the new
     * value is positive and 0 otherwise.
     */
    public static BigDecimal percentChange(BigDecimal oldValue, BigDecimal newValue) {
        BigDecimal previous = oldValue != null ? oldValue : BigDecimal.ZERO;
        BigDecimal current = newValue != null ? newValue : BigDecimal.ZERO;
        if (previous.signum() == 0) {
            return current.signum() > 0 ? HUNDRED : BigDecimal.ZERO;
        }
        return current.subtract(previous)
                .multiply(HUNDRED)
                .divide(previous.abs(), PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal percentChange(long oldValue, long newValue) {
        return percentChange(BigDecimal.valueOf(oldValue), BigDecimal.valueOf(newValue));
    }

    /**
     * {@code part / whole * 100}, or zero when the whole is zero.
     */
    public static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        if (part == null || whole == null || whole.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return part.multiply(HUNDRED).divide(whole, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    public static Statistics statistics(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return new Statistics(0.0, 0.0);
        }
        DescriptiveStatistics stats = new DescriptiveStatistics();
        values.stream().filter(Objects::nonNull).forEach(stats::addValue);
        if (stats.getN() == 0) {
            return new Statistics(0.0, 0.0);
        }
        return new Statistics(stats.getMean(), Math.sqrt(stats.getPopulationVariance()));
    }

    /**
     * Population coefficient of variation. Fewer than two points give 0, a zero mean gives 1.
     */
    public static double coefficientOfVariation(List<BigDecimal> values) {
        if (values == null || values.size() < 2) {
            return 0.0;
        }
        Statistics stats = statistics(toDoubles(values));
        if (stats.mean() == 0.0) {
            return 1.0;
        }
        return stats.standardDeviation() / stats.mean();
    }

    public static List<Double> toDoubles(Collection<BigDecimal> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<Double> out = new ArrayList<>(values.size());
        for (BigDecimal v : values) {
            if (v != null) {
                out.add(v.doubleValue());
            }
        }
        return out;
    }

    /**
     * Non-null line items of {@code sales} that reference a product. Sales without line items
     * contribute nothing.
     */
    public static List<LineItem> productLineItems(Collection<Sale> sales) {
        if (sales == null) {
            return List.of();
        }
        return sales.stream()
                .filter(Objects::nonNull)
                .filter(s -> s.getLineItems() != null)
                .flatMap(s -> s.getLineItems().stream())
                .filter(Objects::nonNull)
                .filter(li -> li.getProductId() != null)
                .toList();
    }

    /**
     * Weekly bucket key: {@code year * 100 + dayOfYear / 7}.
     */
    public static int weekNumber(LocalDate date) {
        return date.getYear() * 100 + (date.getDayOfYear() / 7);
    }

    /**
     * Groups preserving encounter order of the keys.
     */
    public static <K, T> Map<K, List<T>> groupBy(Collection<T> values, Function<T, K> keyFn) {
        Map<K, List<T>> grouped = new LinkedHashMap<>();
        if (values == null) {
            return grouped;
        }
        for (T value : values) {
            if (value == null) {
                continue;
            }
            grouped.computeIfAbsent(keyFn.apply(value), k -> new ArrayList<>()).add(value);
        }
        return grouped;
    }

    public static <K, T extends LedgerTransaction> Map<K, BigDecimal> totalsBy(
            Collection<T> transactions,
            Function<T, K> keyFn
    ) {
        Map<K, BigDecimal> totals = new LinkedHashMap<>();
        groupBy(transactions, keyFn).forEach((key, group) -> totals.put(key, sum(group)));
        return totals;
    }

    public static String formatCurrency(BigDecimal amount) {
        NumberFormat nf = NumberFormat.getCurrencyInstance(Locale.US);
        nf.setMaximumFractionDigits(0);
        nf.setMinimumFractionDigits(0);
        BigDecimal safe = amount != null ? amount : BigDecimal.ZERO;
        return nf.format(safe);
    }

    public static String formatPercent(BigDecimal value, int decimals) {
        BigDecimal safe = value != null ? value : BigDecimal.ZERO;
        return safe.setScale(decimals, RoundingMode.HALF_UP).toPlainString();
    }

    public record Statistics(double mean, double standardDeviation) {

        /**
         * Z-score of {@code value}, empty for a flat series.
         */
        public OptionalDouble zScore(double value) {
            if (standardDeviation <= 0.0) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of((value - mean) / standardDeviation);
        }
    }
}
