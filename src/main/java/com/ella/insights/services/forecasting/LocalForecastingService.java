package com.ella.insights.services.forecasting;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Service;

import com.ella.insights.dto.EnhancedForecastResult;
import com.ella.insights.dto.SeasonalPattern;
import com.ella.insights.enums.ForecastMethod;
import com.ella.insights.services.insights.InsightUtils;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Multi-method forecaster over a chronological series of monthly totals.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocalForecastingService {

    static final int MIN_POINTS_FOR_SSA = 24;
    static final int MIN_POINTS_FOR_HOLT_WINTERS = 12;
    static final int LONG_HISTORY_POINTS = 36;
    static final double FALLBACK_PENALTY = 10.0;
    static final double AGREEMENT_BONUS = 10.0;

    private static final BigDecimal NARROW_BAND = new BigDecimal("0.10");
    private static final BigDecimal WIDE_BAND = new BigDecimal("0.20");
    private static final double NARROW_BAND_CONFIDENCE = 70.0;

    private final TrendForecaster trendForecaster;
    private final HoltWintersForecaster holtWinters;
    private final SsaForecaster ssaForecaster;

    public EnhancedForecastResult generateEnhancedForecast(List<BigDecimal> monthlyData, int periodsToForecast,
                                                           ForecastMethod preferredMethod) {
        return generateEnhancedForecast(monthlyData, periodsToForecast, preferredMethod, null);
    }

    /**
     * @param historicalAccuracy average accuracy (0-100) of past forecasts, or {@code null}
     */
    public EnhancedForecastResult generateEnhancedForecast(List<BigDecimal> monthlyData, int periodsToForecast,
                                                           ForecastMethod preferredMethod, Double historicalAccuracy) {
        Objects.requireNonNull(monthlyData, "monthlyData");
        if (periodsToForecast < 1) {
            throw new IllegalArgumentException("periodsToForecast must be at least 1, got " + periodsToForecast);
        }
        List<BigDecimal> data = List.copyOf(monthlyData);

        if (data.size() < 2) {
            BigDecimal last = data.isEmpty() ? BigDecimal.ZERO : data.get(0);
            List<BigDecimal> repeated = Collections.nCopies(periodsToForecast, last);
            return EnhancedForecastResult.builder()
                    .forecastedValues(repeated)
                    .lowerBounds(repeated)
                    .upperBounds(repeated)
                    .seasonalPattern(SeasonalPattern.none("Insufficient data to detect seasonal patterns."))
                    .confidenceScore(0.0)
                    .methodUsed("Insufficient Data")
                    .dataPointsUsed(data.size())
                    .periodsForecasted(periodsToForecast)
                    .build();
        }

        ForecastMethod method = selectMethod(data.size(), preferredMethod);
        log.debug("Enhanced forecast: {} points, preferred={}, selected={}", data.size(), preferredMethod, method);

        EnhancedForecastResult result = switch (method) {
            case SSA -> ssaWithFallback(data, periodsToForecast, historicalAccuracy);
            case HOLT_WINTERS -> holtWintersForecast(data, periodsToForecast, historicalAccuracy);
            case REGRESSION -> regressionForecast(data, periodsToForecast, historicalAccuracy);
            case COMBINED, AUTO -> combinedForecast(data, periodsToForecast, historicalAccuracy);
        };

        return result.toBuilder()
                .dataPointsUsed(data.size())
                .periodsForecasted(periodsToForecast)
                .build();
    }

    static ForecastMethod selectMethod(int dataPoints, ForecastMethod preferred) {
        ForecastMethod requested = preferred != null ? preferred : ForecastMethod.AUTO;
        return switch (requested) {
            case AUTO -> {
                if (dataPoints >= MIN_POINTS_FOR_SSA) {
                    yield ForecastMethod.COMBINED;
                }
                yield dataPoints >= MIN_POINTS_FOR_HOLT_WINTERS ? ForecastMethod.HOLT_WINTERS : ForecastMethod.REGRESSION;
            }
            case SSA, COMBINED -> dataPoints >= MIN_POINTS_FOR_SSA ? requested : ForecastMethod.HOLT_WINTERS;
            case HOLT_WINTERS, REGRESSION -> requested;
        };
    }

    /**
     * Seasonal pattern of the series, requiring at least twelve points.
     */
    public SeasonalPattern detectSeasonality(List<BigDecimal> monthlyData) {
        if (monthlyData == null || monthlyData.size() < MIN_POINTS_FOR_HOLT_WINTERS) {
            return SeasonalPattern.none("Insufficient data to detect seasonal patterns.");
        }
        int seasonLength = holtWinters.detectSeasonLength(monthlyData);
        return holtWinters.autoForecast(monthlyData, seasonLength, 1).seasonalPattern();
    }

    /**
     * Confidence in [0, 100] built from data quantity, stability, seasonality and past accuracy.
     */
    public double calculateConfidenceScore(List<BigDecimal> historicalData, SeasonalPattern seasonalPattern,
                                           Double historicalAccuracy) {
        int n = historicalData == null ? 0 : historicalData.size();
        double score = Math.min(35.0, n * 1.5);

        if (n >= 3) {
            double cv = InsightUtils.coefficientOfVariation(historicalData);
            score += stabilityScore(cv);
        }

        if (seasonalPattern != null && seasonalPattern.getSeasonalStrength() > 0.1) {
            score += seasonalPattern.getSeasonalStrength() * 20;
        } else if (n >= MIN_POINTS_FOR_HOLT_WINTERS) {
            score += 10;
        }

        if (historicalAccuracy != null && historicalAccuracy > 0) {
            score += historicalAccuracy / 100 * 20;
        }

        return clamp(score);
    }

    private static double stabilityScore(double cv) {
        if (cv < 0.1) {
            return 25;
        }
        if (cv < 0.3) {
            return 20;
        }
        if (cv < 0.5) {
            return 15;
        }
        if (cv < 0.8) {
            return 10;
        }
        return 5;
    }

    private EnhancedForecastResult ssaWithFallback(List<BigDecimal> data, int periods, Double accuracy) {
        try {
            return ssaForecast(data, periods, accuracy);
        } catch (RuntimeException e) {
            log.warn("SSA forecast failed, falling back to Holt-Winters: {}", e.getMessage());
            EnhancedForecastResult hw = holtWintersForecast(data, periods, accuracy);
            return hw.toBuilder()
                    .confidenceScore(clamp(hw.getConfidenceScore() - FALLBACK_PENALTY))
                    .fallbackUsed(true)
                    .build();
        }
    }

    private EnhancedForecastResult ssaForecast(List<BigDecimal> data, int periods, Double accuracy) {
        SsaForecaster.Result ssa = ssaForecaster.forecast(data, periods);
        return EnhancedForecastResult.builder()
                .forecastedValues(ssa.forecastedValues())
                .lowerBounds(ssa.lowerBounds())
                .upperBounds(ssa.upperBounds())
                .seasonalPattern(detectSeasonality(data))
                .confidenceScore(calculateConfidenceScore(data, null, accuracy))
                .methodUsed(ForecastMethod.SSA.getDisplayName())
                .build();
    }

    private EnhancedForecastResult holtWintersForecast(List<BigDecimal> data, int periods, Double accuracy) {
        int seasonLength = holtWinters.detectSeasonLength(data);
        HoltWintersForecaster.Result hw = holtWinters.autoForecast(data, seasonLength, periods);
        double confidence = calculateConfidenceScore(data, hw.seasonalPattern(), accuracy);

        return EnhancedForecastResult.builder()
                .forecastedValues(hw.forecastedValues())
                .lowerBounds(band(hw.forecastedValues(), confidence, false))
                .upperBounds(band(hw.forecastedValues(), confidence, true))
                .seasonalPattern(hw.seasonalPattern())
                .confidenceScore(confidence)
                .methodUsed(hw.method())
                .build();
    }

    private EnhancedForecastResult regressionForecast(List<BigDecimal> data, int periods, Double accuracy) {
        List<BigDecimal> values = trendForecaster.forecast(data, periods);
        SeasonalPattern pattern = detectSeasonality(data);
        double confidence = calculateConfidenceScore(data, pattern, accuracy);

        return EnhancedForecastResult.builder()
                .forecastedValues(values)
                .lowerBounds(band(values, confidence, false))
                .upperBounds(band(values, confidence, true))
                .seasonalPattern(pattern)
                .confidenceScore(confidence)
                .methodUsed(ForecastMethod.REGRESSION.getDisplayName())
                .build();
    }

    /**
     * Decomposition leg (SSA, or Holt-Winters when SSA fails) blended with the regression leg.
     * Bounds take the widest of the two. Agreement between the legs adds up to ten points of
     * confidence; a failed SSA leg instead costs ten.
     */
    private EnhancedForecastResult combinedForecast(List<BigDecimal> data, int periods, Double accuracy) {
        EnhancedForecastResult decomposition;
        boolean fallbackUsed = false;
        try {
            decomposition = ssaForecast(data, periods, accuracy);
        } catch (RuntimeException e) {
            log.warn("SSA leg of combined forecast failed, using Holt-Winters instead: {}", e.getMessage());
            decomposition = holtWintersForecast(data, periods, accuracy);
            fallbackUsed = true;
        }
        EnhancedForecastResult regression = regressionForecast(data, periods, accuracy);

        double decompositionWeight = data.size() >= LONG_HISTORY_POINTS ? 0.6 : 0.5;

        List<BigDecimal> values = new ArrayList<>(periods);
        List<BigDecimal> lower = new ArrayList<>(periods);
        List<BigDecimal> upper = new ArrayList<>(periods);
        for (int i = 0; i < periods; i++) {
            BigDecimal d = valueAt(decomposition.getForecastedValues(), i);
            BigDecimal r = valueAt(regression.getForecastedValues(), i);
            double blended = decompositionWeight * d.doubleValue() + (1 - decompositionWeight) * r.doubleValue();
            values.add(BigDecimal.valueOf(blended).setScale(2, RoundingMode.HALF_UP));

            lower.add(valueAt(decomposition.getLowerBounds(), i).min(valueAt(regression.getLowerBounds(), i)));
            upper.add(valueAt(decomposition.getUpperBounds(), i).max(valueAt(regression.getUpperBounds(), i)));
        }

        double confidence;
        String method;
        if (fallbackUsed) {
            confidence = (decomposition.getConfidenceScore() + regression.getConfidenceScore()) / 2 - FALLBACK_PENALTY;
            method = "Combined (Holt-Winters + Regression)";
        } else {
            double agreement = methodAgreement(decomposition.getForecastedValues(), regression.getForecastedValues());
            confidence = (decomposition.getConfidenceScore() + regression.getConfidenceScore()) / 2
                    + agreement * AGREEMENT_BONUS;
            method = ForecastMethod.COMBINED.getDisplayName();
        }

        return EnhancedForecastResult.builder()
                .forecastedValues(values)
                .lowerBounds(lower)
                .upperBounds(upper)
                .seasonalPattern(detectSeasonality(data))
                .confidenceScore(clamp(confidence))
                .methodUsed(method)
                .fallbackUsed(fallbackUsed)
                .build();
    }

    /**
     * {@code 1 - mean relative difference}, floored at 0. Pairs averaging zero are skipped.
     */
    static double methodAgreement(List<BigDecimal> first, List<BigDecimal> second) {
        int count = Math.min(first.size(), second.size());
        double sum = 0.0;
        int compared = 0;
        for (int i = 0; i < count; i++) {
            double a = first.get(i).doubleValue();
            double b = second.get(i).doubleValue();
            double avg = (a + b) / 2;
            if (avg > 0) {
                sum += Math.abs(a - b) / avg;
                compared++;
            }
        }
        if (compared == 0) {
            return 0.0;
        }
        return Math.max(0.0, 1 - sum / compared);
    }

    private static List<BigDecimal> band(List<BigDecimal> values, double confidence, boolean upper) {
        BigDecimal width = confidence >= NARROW_BAND_CONFIDENCE ? NARROW_BAND : WIDE_BAND;
        BigDecimal factor = upper ? BigDecimal.ONE.add(width) : BigDecimal.ONE.subtract(width);
        return values.stream()
                .map(v -> v.multiply(factor).setScale(2, RoundingMode.HALF_UP))
                .toList();
    }

    private static BigDecimal valueAt(List<BigDecimal> values, int index) {
        return index < values.size() ? values.get(index) : BigDecimal.ZERO;
    }

    private static double clamp(double score) {
        return Math.min(100.0, Math.max(0.0, score));
    }
}
