package com.ella.insights.services.forecasting;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import com.ella.insights.exceptions.ForecastingException;

import lombok.extern.slf4j.Slf4j;

/**
 * Singular spectrum analysis forecaster.
 *
 * <p>The series is embedded into an {@code L x K} trajectory matrix, decomposed with an SVD,
 * reconstructed from the leading components by diagonal averaging and continued with the
 * linear recurrence those components define.</p>
 */
@Slf4j
@Component
public class SsaForecaster {

    static final int MAX_WINDOW = 6;
    static final double ENERGY_RETAINED = 0.9;
    static final double INTERVAL_Z = 1.96;

    private static final int MIN_POINTS = 4;
    private static final double STABILITY_MARGIN = 1e-9;

    public record Result(List<BigDecimal> forecastedValues, List<BigDecimal> lowerBounds,
                         List<BigDecimal> upperBounds, int windowLength, int components) {
    }

    public Result forecast(List<BigDecimal> data, int periods) {
        int n = data == null ? 0 : data.size();
        if (n < MIN_POINTS) {
            throw new ForecastingException("SSA needs at least " + MIN_POINTS + " points, got " + n);
        }

        double[] series = new double[n];
        for (int i = 0; i < n; i++) {
            series[i] = data.get(i).doubleValue();
        }

        int window = windowLength(n);
        int columns = n - window + 1;

        double[][] trajectory = new double[window][columns];
        for (int i = 0; i < window; i++) {
            for (int j = 0; j < columns; j++) {
                trajectory[i][j] = series[i + j];
            }
        }

        SingularValueDecomposition svd = new SingularValueDecomposition(MatrixUtils.createRealMatrix(trajectory));
        double[] singularValues = svd.getSingularValues();
        RealMatrix u = svd.getU();
        RealMatrix v = svd.getV();

        int rank = componentsToKeep(singularValues, window);
        if (rank == 0) {
            // all-zero series
            List<BigDecimal> zeros = new ArrayList<>();
            for (int h = 0; h < periods; h++) {
                zeros.add(BigDecimal.ZERO);
            }
            return new Result(zeros, zeros, zeros, window, 0);
        }

        double[] reconstructed = reconstruct(u, v, singularValues, rank, window, columns, n);
        double[] recurrence = recurrence(u, rank, window);

        double[] extended = new double[n + periods];
        System.arraycopy(reconstructed, 0, extended, 0, n);
        for (int t = n; t < n + periods; t++) {
            double next = 0.0;
            for (int j = 0; j < window - 1; j++) {
                next += recurrence[j] * extended[t - window + 1 + j];
            }
            if (Double.isNaN(next) || Double.isInfinite(next)) {
                throw new ForecastingException("SSA produced a non-finite forecast at step " + (t - n + 1));
            }
            extended[t] = next;
        }

        DescriptiveStatistics residuals = new DescriptiveStatistics();
        for (int i = 0; i < n; i++) {
            residuals.addValue(series[i] - reconstructed[i]);
        }
        double margin = INTERVAL_Z * Math.sqrt(residuals.getPopulationVariance());
        if (Double.isNaN(margin) || Double.isInfinite(margin)) {
            throw new ForecastingException("SSA residual margin is not finite");
        }

        List<BigDecimal> values = new ArrayList<>(periods);
        List<BigDecimal> lower = new ArrayList<>(periods);
        List<BigDecimal> upper = new ArrayList<>(periods);
        for (int t = n; t < n + periods; t++) {
            double f = extended[t];
            values.add(money(Math.max(0.0, f)));
            lower.add(money(Math.max(0.0, f - margin)));
            upper.add(money(Math.max(0.0, f + margin)));
        }

        log.debug("SSA window={} components={} of {} residualMargin={}", window, rank, singularValues.length, margin);
        return new Result(values, lower, upper, window, rank);
    }

    static int windowLength(int n) {
        return Math.max(2, Math.min(MAX_WINDOW, n / 4));
    }

    /**
     * Smallest number of leading components holding 90% of the squared singular values,
     * capped at {@code window - 1} so the recurrence stays defined.
     */
    static int componentsToKeep(double[] singularValues, int window) {
        double total = 0.0;
        for (double s : singularValues) {
            total += s * s;
        }
        if (total <= 0.0) {
            return 0;
        }

        double cumulative = 0.0;
        int rank = 0;
        for (double s : singularValues) {
            cumulative += s * s;
            rank++;
            if (cumulative / total >= ENERGY_RETAINED) {
                break;
            }
        }
        return Math.max(1, Math.min(rank, window - 1));
    }

    private static double[] reconstruct(RealMatrix u, RealMatrix v, double[] singularValues, int rank,
                                        int window, int columns, int n) {
        double[][] approx = new double[window][columns];
        for (int k = 0; k < rank; k++) {
            double sigma = singularValues[k];
            for (int i = 0; i < window; i++) {
                double ui = u.getEntry(i, k) * sigma;
                for (int j = 0; j < columns; j++) {
                    approx[i][j] += ui * v.getEntry(j, k);
                }
            }
        }

        double[] sums = new double[n];
        int[] counts = new int[n];
        for (int i = 0; i < window; i++) {
            for (int j = 0; j < columns; j++) {
                sums[i + j] += approx[i][j];
                counts[i + j]++;
            }
        }
        double[] out = new double[n];
        for (int t = 0; t < n; t++) {
            out[t] = sums[t] / counts[t];
        }
        return out;
    }

    /**
     * Coefficients of the linear recurrence over the previous {@code window - 1} values.
     *
     * @throws ForecastingException when the verticality coefficient reaches 1
     */
    private static double[] recurrence(RealMatrix u, int rank, int window) {
        double verticality = 0.0;
        for (int k = 0; k < rank; k++) {
            double last = u.getEntry(window - 1, k);
            verticality += last * last;
        }
        if (verticality >= 1.0 - STABILITY_MARGIN) {
            throw new ForecastingException("SSA recurrence is unstable (verticality " + verticality + ")");
        }

        double[] coefficients = new double[window - 1];
        for (int k = 0; k < rank; k++) {
            double last = u.getEntry(window - 1, k);
            for (int j = 0; j < window - 1; j++) {
                coefficients[j] += last * u.getEntry(j, k);
            }
        }
        for (int j = 0; j < coefficients.length; j++) {
            coefficients[j] /= 1.0 - verticality;
        }
        return coefficients;
    }

    private static BigDecimal money(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}
