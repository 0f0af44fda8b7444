package com.ella.insights.services.forecasting;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

import com.ella.insights.dto.SeasonalPattern;
import com.ella.insights.enums.TrendDirection;

/**
 * Holt-Winters triple exponential smoothing with additive and multiplicative seasonality.
 * Seasonal factors are indexed by phase, {@code t % seasonLength}, relative to the first
 * observation of the series.
 */
@Component
public class HoltWintersForecaster {

    static final double ALPHA = 0.3;
    static final double BETA = 0.1;
    static final double GAMMA = 0.2;

    static final int YEARLY_SEASON = 12;
    static final int[] CANDIDATE_SEASON_LENGTHS = {YEARLY_SEASON, 6, 4, 3};

    private static final double MULTIPLICATIVE_CV_SPREAD = 0.3;
    private static final double EPSILON = 0.0001;
    private static final double NOTABLE_STRENGTH = 0.1;

    private static final String[] MONTHS = {"January", "February", "March", "April", "May", "June",
            "July", "August", "September", "October", "November", "December"};
    private static final String[] MONTH_PAIRS = {"Jan-Feb", "Mar-Apr", "May-Jun", "Jul-Aug", "Sep-Oct", "Nov-Dec"};
    private static final String[] QUARTERS = {"Q1 (Jan-Mar)", "Q2 (Apr-Jun)", "Q3 (Jul-Sep)", "Q4 (Oct-Dec)"};

    public record Result(
            List<BigDecimal> forecastedValues,
            SeasonalPattern seasonalPattern,
            double finalLevel,
            double finalTrend,
            String method
    ) {
        public BigDecimal forecastedValue() {
            return forecastedValues.isEmpty() ? BigDecimal.ZERO : forecastedValues.get(0);
        }
    }

    public Result forecastAdditive(List<BigDecimal> data, int seasonLength, int periods) {
        if (data.size() < seasonLength * 2) {
            return fallback(data, periods);
        }

        double[] values = toArray(data);
        int n = values.length;

        double level = StatUtils.mean(values, 0, seasonLength);
        double trend = (StatUtils.mean(values, seasonLength, seasonLength) - level) / seasonLength;
        double[] seasonals = new double[seasonLength];
        for (int i = 0; i < seasonLength; i++) {
            seasonals[i] = values[i] - level;
        }

        for (int t = 1; t < n; t++) {
            int phase = t % seasonLength;
            double previousSeasonal = seasonals[phase];
            double previousLevel = level;

            level = ALPHA * (values[t] - previousSeasonal) + (1 - ALPHA) * (previousLevel + trend);
            trend = BETA * (level - previousLevel) + (1 - BETA) * trend;
            seasonals[phase] = GAMMA * (values[t] - level) + (1 - GAMMA) * previousSeasonal;
        }

        List<BigDecimal> forecasts = new ArrayList<>(periods);
        for (int h = 1; h <= periods; h++) {
            double seasonal = seasonals[(n + h - 1) % seasonLength];
            forecasts.add(nonNegative(level + h * trend + seasonal));
        }

        List<Double> factors = boxed(seasonals);
        double meanSquare = factors.stream().mapToDouble(s -> s * s).average().orElse(0.0);
        double dataVariance = values.length < 2 ? 0.0 : StatUtils.variance(values);
        double strength = dataVariance > 0 ? Math.min(1.0, meanSquare / dataVariance) : 0.0;

        return new Result(forecasts, pattern(seasonLength, factors, strength, trend), level, trend,
                "Holt-Winters Additive");
    }

    public Result forecastMultiplicative(List<BigDecimal> data, int seasonLength, int periods) {
        if (data.size() < seasonLength * 2) {
            return fallback(data, periods);
        }

        double[] values = toArray(data);
        for (double v : values) {
            if (v <= 0) {
                return forecastAdditive(data, seasonLength, periods);
            }
        }
        int n = values.length;

        double level = Math.max(EPSILON, StatUtils.mean(values, 0, seasonLength));
        double trend = (StatUtils.mean(values, seasonLength, seasonLength) - level) / seasonLength;
        double[] seasonals = new double[seasonLength];
        for (int i = 0; i < seasonLength; i++) {
            seasonals[i] = Math.max(EPSILON, values[i] / level);
        }

        for (int t = 1; t < n; t++) {
            int phase = t % seasonLength;
            double previousSeasonal = Math.abs(seasonals[phase]) < EPSILON ? EPSILON : seasonals[phase];
            double previousLevel = level;

            level = ALPHA * (values[t] / previousSeasonal) + (1 - ALPHA) * (previousLevel + trend);
            trend = BETA * (level - previousLevel) + (1 - BETA) * trend;
            double levelForSeasonal = Math.abs(level) < EPSILON ? EPSILON : level;
            seasonals[phase] = GAMMA * (values[t] / levelForSeasonal) + (1 - GAMMA) * previousSeasonal;
        }

        List<BigDecimal> forecasts = new ArrayList<>(periods);
        for (int h = 1; h <= periods; h++) {
            double seasonal = seasonals[(n + h - 1) % seasonLength];
            forecasts.add(nonNegative((level + h * trend) * seasonal));
        }

        List<Double> factors = boxed(seasonals);
        double deviation = factors.stream().mapToDouble(s -> Math.abs(s - 1)).average().orElse(0.0);
        double strength = Math.min(1.0, deviation * 5);

        return new Result(forecasts, pattern(seasonLength, factors, strength, trend), level, trend,
                "Holt-Winters Multiplicative");
    }

    /**
     * Picks multiplicative seasonality when each phase varies by a similar relative amount,
     * additive otherwise or when the series has non-positive values.
     */
    public Result autoForecast(List<BigDecimal> data, int seasonLength, int periods) {
        if (data.size() < seasonLength) {
            return fallback(data, periods);
        }

        double[] values = toArray(data);
        for (double v : values) {
            if (v <= 0) {
                return forecastAdditive(data, seasonLength, periods);
            }
        }

        DescriptiveStatistics cvs = new DescriptiveStatistics();
        for (int phase = 0; phase < seasonLength; phase++) {
            DescriptiveStatistics group = new DescriptiveStatistics();
            for (int i = phase; i < values.length; i += seasonLength) {
                group.addValue(values[i]);
            }
            double mean = group.getMean();
            if (mean > 0) {
                double sd = group.getN() < 2 ? 0.0 : group.getStandardDeviation();
                cvs.addValue(sd / mean);
            }
        }
        double cvSpread = cvs.getN() < 2 ? 0.0 : cvs.getStandardDeviation();

        if (cvSpread < MULTIPLICATIVE_CV_SPREAD) {
            return forecastMultiplicative(data, seasonLength, periods);
        }
        return forecastAdditive(data, seasonLength, periods);
    }

    /**
     * Chooses the candidate cycle whose seasonal decomposition leaves the least residual
     * variance. The variance is divided by {@code n - L - 2} so longer cycles pay for their
     * extra factors. A candidate needs two full cycles of data, except the yearly one, which
     * needs twelve points. The divisor must stay positive, so a yearly cycle is scored from
     * fifteen points on.
     */
    public int detectSeasonLength(List<BigDecimal> data) {
        double[] values = toArray(data);
        int n = values.length;

        int best = -1;
        double bestVariance = Double.MAX_VALUE;
        for (int length : CANDIDATE_SEASON_LENGTHS) {
            int degreesOfFreedom = n - length - 2;
            if (n < minimumPoints(length) || degreesOfFreedom <= 0) {
                continue;
            }
            double variance = residualSumOfSquares(values, length) / degreesOfFreedom;
            if (variance < bestVariance) {
                bestVariance = variance;
                best = length;
            }
        }

        if (best < 0) {
            return Math.max(2, Math.min(4, n / 2));
        }
        return best;
    }

    private static int minimumPoints(int seasonLength) {
        return seasonLength == YEARLY_SEASON ? YEARLY_SEASON : seasonLength * 2;
    }

    private static double residualSumOfSquares(double[] values, int seasonLength) {
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            regression.addData(i, values[i]);
        }

        double[] detrended = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            detrended[i] = values[i] - regression.predict(i);
        }

        double[] phaseMeans = new double[seasonLength];
        int[] phaseCounts = new int[seasonLength];
        for (int i = 0; i < detrended.length; i++) {
            phaseMeans[i % seasonLength] += detrended[i];
            phaseCounts[i % seasonLength]++;
        }
        for (int p = 0; p < seasonLength; p++) {
            phaseMeans[p] = phaseCounts[p] > 0 ? phaseMeans[p] / phaseCounts[p] : 0.0;
        }

        double sum = 0.0;
        for (int i = 0; i < detrended.length; i++) {
            double residual = detrended[i] - phaseMeans[i % seasonLength];
            sum += residual * residual;
        }
        return sum;
    }

    /**
     * Simple exponential smoothing with a straight line through the first and last values.
     */
    Result fallback(List<BigDecimal> data, int periods) {
        if (data.isEmpty()) {
            return new Result(Collections.nCopies(periods, BigDecimal.ZERO),
                    SeasonalPattern.none("Insufficient data for seasonal analysis."), 0.0, 0.0, "No Data");
        }

        double smoothed = TrendForecaster.exponentialSmoothing(data, ALPHA);
        double trend = data.size() > 1
                ? (data.get(data.size() - 1).doubleValue() - data.get(0).doubleValue()) / (data.size() - 1)
                : 0.0;

        List<BigDecimal> forecasts = new ArrayList<>(periods);
        for (int h = 1; h <= periods; h++) {
            forecasts.add(nonNegative(smoothed + h * trend));
        }

        return new Result(forecasts, SeasonalPattern.none("Insufficient data for seasonal analysis."),
                smoothed, trend, "Simple Exponential Smoothing");
    }

    private static SeasonalPattern pattern(int seasonLength, List<Double> factors, double strength, double trend) {
        return SeasonalPattern.builder()
                .seasonLength(seasonLength)
                .seasonalFactors(factors)
                .seasonalStrength(strength)
                .trendDirection(TrendDirection.fromSlope(trend))
                .trendSlope(trend)
                .description(describe(factors, seasonLength, strength))
                .build();
    }

    static String describe(List<Double> factors, int seasonLength, double strength) {
        if (strength < NOTABLE_STRENGTH || factors.isEmpty()) {
            return "No significant seasonal pattern detected.";
        }

        int peak = factors.indexOf(Collections.max(factors));
        int trough = factors.indexOf(Collections.min(factors));

        String peakPeriod;
        String troughPeriod;
        String cycle;
        switch (seasonLength) {
            case 12 -> {
                peakPeriod = MONTHS[peak % 12];
                troughPeriod = MONTHS[trough % 12];
                cycle = "yearly";
            }
            case 6 -> {
                peakPeriod = MONTH_PAIRS[peak % 6];
                troughPeriod = MONTH_PAIRS[trough % 6];
                cycle = "bi-monthly";
            }
            case 4 -> {
                peakPeriod = QUARTERS[peak % 4];
                troughPeriod = QUARTERS[trough % 4];
                cycle = "quarterly";
            }
            case 3 -> {
                peakPeriod = positionInThree(peak);
                troughPeriod = positionInThree(trough);
                cycle = "3-month";
            }
            case 2 -> {
                peakPeriod = peak == 0 ? "first month" : "second month";
                troughPeriod = trough == 0 ? "first month" : "second month";
                cycle = "bi-monthly";
            }
            default -> {
                peakPeriod = "period " + (peak + 1);
                troughPeriod = "period " + (trough + 1);
                cycle = seasonLength + "-period";
            }
        }

        String strengthLabel = strength > 0.5 ? "strong" : strength > 0.25 ? "moderate" : "mild";
        return String.format("A %s %s pattern detected. Peak at %s of cycle, lowest at %s.",
                strengthLabel, cycle, peakPeriod, troughPeriod);
    }

    private static String positionInThree(int index) {
        return switch (index) {
            case 0 -> "beginning";
            case 1 -> "middle";
            default -> "end";
        };
    }

    private static double[] toArray(List<BigDecimal> data) {
        double[] values = new double[data.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = data.get(i).doubleValue();
        }
        return values;
    }

    private static List<Double> boxed(double[] values) {
        List<Double> out = new ArrayList<>(values.length);
        for (double v : values) {
            out.add(v);
        }
        return List.copyOf(out);
    }

    private static BigDecimal nonNegative(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(Math.max(0.0, value)).setScale(2, RoundingMode.HALF_UP);
    }
}
