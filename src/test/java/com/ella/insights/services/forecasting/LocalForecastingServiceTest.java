package com.ella.insights.services.forecasting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.ella.insights.config.InsightsProperties;
import com.ella.insights.dto.EnhancedForecastResult;
import com.ella.insights.dto.SeasonalPattern;
import com.ella.insights.enums.ForecastMethod;
import com.ella.insights.exceptions.ForecastingException;
import com.ella.insights.support.LedgerFixtures;

@ExtendWith(MockitoExtension.class)
class LocalForecastingServiceTest {

    @Mock
    private SsaForecaster ssaForecaster;

    private final LocalForecastingService service = LedgerFixtures.localForecastingService(InsightsProperties.defaults());

    @Test
    void autoSelectsByHistoryLength() {
        assertEquals(ForecastMethod.REGRESSION, LocalForecastingService.selectMethod(11, ForecastMethod.AUTO));
        assertEquals(ForecastMethod.HOLT_WINTERS, LocalForecastingService.selectMethod(12, ForecastMethod.AUTO));
        assertEquals(ForecastMethod.HOLT_WINTERS, LocalForecastingService.selectMethod(23, null));
        assertEquals(ForecastMethod.COMBINED, LocalForecastingService.selectMethod(24, ForecastMethod.AUTO));
    }

    @Test
    @DisplayName("Decomposition methods degrade to Holt-Winters on short histories")
    void decompositionNeedsTwoYears() {
        assertEquals(ForecastMethod.HOLT_WINTERS, LocalForecastingService.selectMethod(23, ForecastMethod.SSA));
        assertEquals(ForecastMethod.HOLT_WINTERS, LocalForecastingService.selectMethod(23, ForecastMethod.COMBINED));
        assertEquals(ForecastMethod.SSA, LocalForecastingService.selectMethod(24, ForecastMethod.SSA));
        assertEquals(ForecastMethod.REGRESSION, LocalForecastingService.selectMethod(3, ForecastMethod.REGRESSION));
    }

    @Test
    void singlePointRepeatsTheValue() {
        EnhancedForecastResult result = service.generateEnhancedForecast(List.of(new BigDecimal("500")), 3, ForecastMethod.AUTO);

        assertEquals("Insufficient Data", result.getMethodUsed());
        assertEquals(0.0, result.getConfidenceScore());
        assertThat(result.getForecastedValues()).containsExactly(
                new BigDecimal("500"), new BigDecimal("500"), new BigDecimal("500"));
        assertEquals(1, result.getDataPointsUsed());
    }

    @Test
    void rejectsNonPositiveHorizon() {
        assertThrows(IllegalArgumentException.class,
                () -> service.generateEnhancedForecast(List.of(BigDecimal.ONE, BigDecimal.TEN), 0, ForecastMethod.AUTO));
    }

    @Test
    @DisplayName("Regression forecasts carry a 20% band at low confidence")
    void regressionBands() {
        EnhancedForecastResult result = service.generateEnhancedForecast(
                series(100, 200, 300, 400), 1, ForecastMethod.AUTO);

        assertEquals(ForecastMethod.REGRESSION.getDisplayName(), result.getMethodUsed());
        assertEquals(21.0, result.getConfidenceScore(), 1e-9);
        assertEquals(new BigDecimal("348.02"), result.getForecastedValue());
        assertEquals(new BigDecimal("278.42"), result.getLowerBounds().get(0));
        assertEquals(new BigDecimal("417.62"), result.getUpperBounds().get(0));
    }

    @Test
    void midLengthHistoryUsesHoltWinters() {
        List<BigDecimal> data = new ArrayList<>();
        for (int c = 0; c < 4; c++) {
            data.addAll(series(100, 200, 150, 50));
        }

        EnhancedForecastResult result = service.generateEnhancedForecast(data, 2, ForecastMethod.AUTO);

        assertEquals("Holt-Winters Multiplicative", result.getMethodUsed());
        assertEquals(16, result.getDataPointsUsed());
        assertEquals(2, result.getPeriodsForecasted());
        assertEquals(4, result.getSeasonalPattern().getSeasonLength());
    }

    @Test
    void longHistoryUsesCombinedEnsemble() {
        EnhancedForecastResult result = service.generateEnhancedForecast(rising(24), 1, ForecastMethod.AUTO);

        assertEquals(ForecastMethod.COMBINED.getDisplayName(), result.getMethodUsed());
        assertFalse(result.isFallbackUsed());
        assertThat(result.getLowerBounds().get(0)).isLessThanOrEqualTo(result.getForecastedValue());
        assertThat(result.getUpperBounds().get(0)).isGreaterThanOrEqualTo(result.getForecastedValue());
        assertThat(result.getConfidenceScore()).isBetween(0.0, 100.0);
    }

    @Test
    @DisplayName("A failing SSA costs ten points of the Holt-Winters confidence")
    void ssaFailureFallsBackToHoltWinters() {
        when(ssaForecaster.forecast(anyList(), anyInt())).thenThrow(new ForecastingException("unstable"));
        LocalForecastingService withBrokenSsa = new LocalForecastingService(
                new TrendForecaster(InsightsProperties.defaults()), new HoltWintersForecaster(), ssaForecaster);
        List<BigDecimal> data = rising(24);

        EnhancedForecastResult holtWinters = withBrokenSsa.generateEnhancedForecast(data, 1, ForecastMethod.HOLT_WINTERS);
        EnhancedForecastResult ssa = withBrokenSsa.generateEnhancedForecast(data, 1, ForecastMethod.SSA);

        assertTrue(ssa.isFallbackUsed());
        assertEquals(holtWinters.getMethodUsed(), ssa.getMethodUsed());
        assertEquals(holtWinters.getConfidenceScore() - 10, ssa.getConfidenceScore(), 1e-9);
        assertEquals(holtWinters.getForecastedValue(), ssa.getForecastedValue());
    }

    @Test
    void combinedWithFailingSsaBlendsHoltWintersAndRegression() {
        when(ssaForecaster.forecast(anyList(), anyInt())).thenThrow(new ForecastingException("unstable"));
        LocalForecastingService withBrokenSsa = new LocalForecastingService(
                new TrendForecaster(InsightsProperties.defaults()), new HoltWintersForecaster(), ssaForecaster);
        List<BigDecimal> data = rising(24);

        EnhancedForecastResult holtWinters = withBrokenSsa.generateEnhancedForecast(data, 1, ForecastMethod.HOLT_WINTERS);
        EnhancedForecastResult regression = withBrokenSsa.generateEnhancedForecast(data, 1, ForecastMethod.REGRESSION);
        EnhancedForecastResult combined = withBrokenSsa.generateEnhancedForecast(data, 1, ForecastMethod.COMBINED);

        assertTrue(combined.isFallbackUsed());
        assertEquals("Combined (Holt-Winters + Regression)", combined.getMethodUsed());
        double expected = Math.max(0.0, (holtWinters.getConfidenceScore() + regression.getConfidenceScore()) / 2 - 10);
        assertEquals(expected, combined.getConfidenceScore(), 1e-9);
    }

    @Test
    @DisplayName("Any runtime failure of SSA degrades to Holt-Winters instead of escaping")
    void unexpectedSsaFailureFallsBack() {
        when(ssaForecaster.forecast(anyList(), anyInt())).thenThrow(new IllegalStateException("matrix is singular"));
        LocalForecastingService withBrokenSsa = new LocalForecastingService(
                new TrendForecaster(InsightsProperties.defaults()), new HoltWintersForecaster(), ssaForecaster);
        List<BigDecimal> data = rising(24);

        EnhancedForecastResult holtWinters = withBrokenSsa.generateEnhancedForecast(data, 1, ForecastMethod.HOLT_WINTERS);
        EnhancedForecastResult ssa = withBrokenSsa.generateEnhancedForecast(data, 1, ForecastMethod.SSA);
        EnhancedForecastResult combined = withBrokenSsa.generateEnhancedForecast(data, 1, ForecastMethod.COMBINED);

        assertTrue(ssa.isFallbackUsed());
        assertEquals(holtWinters.getConfidenceScore() - 10, ssa.getConfidenceScore(), 1e-9);
        assertTrue(combined.isFallbackUsed());
        assertEquals("Combined (Holt-Winters + Regression)", combined.getMethodUsed());
    }

    @Test
    @DisplayName("Confidence never drops as a stable history grows")
    void confidenceGrowsWithData() {
        double previous = -1;
        for (int n = 2; n <= 24; n++) {
            double score = service.calculateConfidenceScore(Collections.nCopies(n, new BigDecimal("100")), null, null);
            assertThat(score).isGreaterThanOrEqualTo(previous);
            previous = score;
        }
        assertEquals(70.0, previous, 1e-9);
    }

    @Test
    void confidenceComponents() {
        List<BigDecimal> stable = Collections.nCopies(24, new BigDecimal("100"));
        SeasonalPattern seasonal = SeasonalPattern.builder().seasonLength(12).seasonalStrength(0.5).build();

        assertEquals(3.0, service.calculateConfidenceScore(stable.subList(0, 2), null, null), 1e-9);
        assertEquals(29.5, service.calculateConfidenceScore(stable.subList(0, 3), null, null), 1e-9);
        assertEquals(53.0, service.calculateConfidenceScore(stable.subList(0, 12), null, null), 1e-9);
        assertEquals(88.0, service.calculateConfidenceScore(stable, null, 90.0), 1e-9);
        assertEquals(70.0, service.calculateConfidenceScore(stable, seasonal, null), 1e-9);
        assertEquals(0.0, service.calculateConfidenceScore(List.of(), null, null), 1e-9);
    }

    @Test
    void seasonalityNeedsTwelvePoints() {
        SeasonalPattern pattern = service.detectSeasonality(series(1, 2, 3));

        assertEquals(0, pattern.getSeasonLength());
        assertEquals("Insufficient data to detect seasonal patterns.", pattern.getDescription());
    }

    @Test
    void agreementIsOneMinusMeanRelativeDifference() {
        assertEquals(1.0, LocalForecastingService.methodAgreement(series(100), series(100)), 1e-9);
        assertEquals(0.0, LocalForecastingService.methodAgreement(series(100), series(300)), 1e-9);
        assertEquals(0.0, LocalForecastingService.methodAgreement(series(0), series(0)), 1e-9);
    }

    private static List<BigDecimal> rising(int n) {
        List<BigDecimal> data = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            data.add(BigDecimal.valueOf(1000 + 50L * i + (i % 3) * 40L));
        }
        return data;
    }

    private static List<BigDecimal> series(int... raw) {
        List<BigDecimal> out = new ArrayList<>();
        for (int v : raw) {
            out.add(BigDecimal.valueOf(v));
        }
        return out;
    }
}
