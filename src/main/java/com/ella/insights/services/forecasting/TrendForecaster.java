package com.ella.insights.services.forecasting;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

import com.ella.insights.config.InsightsProperties;

import lombok.RequiredArgsConstructor;

/**
 * Next-period forecaster blending an ordinary least squares trend with single exponential
 * smoothing. Used for the business forecast and as one leg of the ensemble.
 */
@Component
@RequiredArgsConstructor
public class TrendForecaster {

    static final int AMPLE_DATA_POINTS = 6;
    static final double REGRESSION_WEIGHT_AMPLE = 0.6;
    static final double REGRESSION_WEIGHT_SPARSE = 0.4;

    private static final int MONEY_SCALE = 2;

    private final InsightsProperties properties;

    /**
     * Weighted regression and smoothing forecast for the period after the last value.
     * With fewer than two points the last known value (or zero) is returned.
     */
    public BigDecimal forecastNextPeriod(List<BigDecimal> series) {
        if (series == null || series.isEmpty()) {
            return BigDecimal.ZERO;
        }
        if (series.size() < 2) {
            return series.get(series.size() - 1);
        }

        double linear = linearRegressionForecast(series).doubleValue();
        double smoothed = exponentialSmoothing(series, properties.smoothingAlpha());

        double weight = series.size() >= AMPLE_DATA_POINTS ? REGRESSION_WEIGHT_AMPLE : REGRESSION_WEIGHT_SPARSE;
        double combined = linear * weight + smoothed * (1 - weight);
        return money(combined);
    }

    /**
     * Forecasts {@code periods} steps by feeding each forecast back into the series.
     */
    public List<BigDecimal> forecast(List<BigDecimal> series, int periods) {
        List<BigDecimal> extended = new ArrayList<>(series != null ? series : List.of());
        List<BigDecimal> out = new ArrayList<>(periods);
        for (int h = 0; h < periods; h++) {
            BigDecimal next = forecastNextPeriod(extended);
            out.add(next);
            extended.add(next);
        }
        return out;
    }

    /**
     * Least squares line over {@code (i, series[i])} evaluated at {@code x = n}, never negative.
     */
    public BigDecimal linearRegressionForecast(List<BigDecimal> series) {
        int n = series.size();
        if (n < 2) {
            return n == 0 ? BigDecimal.ZERO : series.get(0);
        }

        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(i, series.get(i).doubleValue());
        }

        double prediction = regression.predict(n);
        if (Double.isNaN(prediction) || Double.isInfinite(prediction)) {
            return series.get(n - 1);
        }
        return money(Math.max(0.0, prediction));
    }

    /**
     * Smoothed level after the last observation, seeded with the first value.
     */
    public static double exponentialSmoothing(List<BigDecimal> series, double alpha) {
        if (series.isEmpty()) {
            return 0.0;
        }
        double smoothed = series.get(0).doubleValue();
        for (int i = 1; i < series.size(); i++) {
            smoothed = alpha * series.get(i).doubleValue() + (1 - alpha) * smoothed;
        }
        return smoothed;
    }

    private static BigDecimal money(double value) {
        return BigDecimal.valueOf(value).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
