package com.ella.insights.services.insights;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.ella.insights.dto.AnalysisDateRange;
import com.ella.insights.dto.DataSufficiencyResult;
import com.ella.insights.dto.ForecastData;
import com.ella.insights.dto.InsightItem;
import com.ella.insights.dto.InsightsData;
import com.ella.insights.dto.InsightsSummary;
import com.ella.insights.ledger.CompanyData;
import com.ella.insights.services.forecasting.ForecastService;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the engine. Every operation reads one immutable ledger snapshot and never
 * writes to it, so the asynchronous variants may run side by side on the same data.
 */
@Slf4j
@Service
public class InsightsService {

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final DataSufficiencyChecker sufficiencyChecker;
    private final TrendAnalysisService trendAnalysisService;
    private final AnomalyDetectionService anomalyDetectionService;
    private final RecommendationService recommendationService;
    private final ForecastService forecastService;
    private final Clock clock;
    private final Executor executor;

    public InsightsService(
            DataSufficiencyChecker sufficiencyChecker,
            TrendAnalysisService trendAnalysisService,
            AnomalyDetectionService anomalyDetectionService,
            RecommendationService recommendationService,
            ForecastService forecastService,
            Clock clock,
            @Qualifier("insightsTaskExecutor") Executor executor
    ) {
        this.sufficiencyChecker = sufficiencyChecker;
        this.trendAnalysisService = trendAnalysisService;
        this.anomalyDetectionService = anomalyDetectionService;
        this.recommendationService = recommendationService;
        this.forecastService = forecastService;
        this.clock = clock;
        this.executor = executor;
    }

    public InsightsData generateInsights(CompanyData companyData, AnalysisDateRange dateRange) {
        return generateInsights(companyData, dateRange, NEVER_CANCELLED);
    }

    public ForecastData generateForecast(CompanyData companyData, AnalysisDateRange dateRange) {
        return forecastService.generateForecast(newCache(companyData, dateRange));
    }

    public List<InsightItem> detectAnomalies(CompanyData companyData, AnalysisDateRange dateRange) {
        return anomalyDetectionService.analyze(newCache(companyData, dateRange));
    }

    public List<InsightItem> analyzeTrends(CompanyData companyData, AnalysisDateRange dateRange) {
        return trendAnalysisService.analyze(newCache(companyData, dateRange));
    }

    public List<InsightItem> generateRecommendations(CompanyData companyData, AnalysisDateRange dateRange) {
        return recommendationService.analyze(newCache(companyData, dateRange));
    }

    public CompletableFuture<InsightsData> generateInsightsAsync(CompanyData companyData, AnalysisDateRange dateRange) {
        return submit(cancelled -> generateInsights(companyData, dateRange, cancelled));
    }

    public CompletableFuture<ForecastData> generateForecastAsync(CompanyData companyData, AnalysisDateRange dateRange) {
        return submit(cancelled -> {
            checkCancelled(cancelled);
            return generateForecast(companyData, dateRange);
        });
    }

    public CompletableFuture<List<InsightItem>> detectAnomaliesAsync(CompanyData companyData, AnalysisDateRange dateRange) {
        return submit(cancelled -> {
            checkCancelled(cancelled);
            return detectAnomalies(companyData, dateRange);
        });
    }

    public CompletableFuture<List<InsightItem>> analyzeTrendsAsync(CompanyData companyData, AnalysisDateRange dateRange) {
        return submit(cancelled -> {
            checkCancelled(cancelled);
            return analyzeTrends(companyData, dateRange);
        });
    }

    public CompletableFuture<List<InsightItem>> generateRecommendationsAsync(CompanyData companyData, AnalysisDateRange dateRange) {
        return submit(cancelled -> {
            checkCancelled(cancelled);
            return generateRecommendations(companyData, dateRange);
        });
    }

    private InsightsData generateInsights(CompanyData companyData, AnalysisDateRange dateRange, BooleanSupplier cancelled) {
        InsightDataCache cache = newCache(companyData, dateRange);
        LocalDateTime generatedAt = LocalDateTime.now(clock);

        checkCancelled(cancelled);
        DataSufficiencyResult sufficiency = sufficiencyChecker.check(cache);
        if (!sufficiency.hasSufficientData()) {
            log.info("[Insights] insufficient data for {}: {}", dateRange, sufficiency.message());
            return InsightsData.builder()
                    .hasSufficientData(false)
                    .insufficientDataMessage(sufficiency.message())
                    .generatedAt(generatedAt)
                    .build();
        }

        log.info("[Insights] analysing {} ({} sales, {} purchases, {} month(s))",
                dateRange, cache.getCurrentSales().size(), cache.getCurrentPurchases().size(), sufficiency.monthsOfData());

        checkCancelled(cancelled);
        List<InsightItem> trends = trendAnalysisService.analyze(cache);

        checkCancelled(cancelled);
        List<InsightItem> anomalies = anomalyDetectionService.analyze(cache);

        checkCancelled(cancelled);
        ForecastData forecast = forecastService.generateForecast(cache);
        List<InsightItem> forecasts = forecastService.generateForecastInsights(cache, forecast);

        checkCancelled(cancelled);
        List<InsightItem> recommendations = recommendationService.analyze(cache);

        InsightsSummary summary = InsightsSummary.builder()
                .totalInsights(trends.size() + anomalies.size() + forecasts.size() + recommendations.size())
                .trendsDetected(trends.size())
                .anomaliesDetected(anomalies.size())
                .forecastsGenerated(forecasts.size())
                .opportunities(recommendations.size())
                .monthsOfData(sufficiency.monthsOfData())
                .build();

        log.info("[Insights] {} insight(s) for {}: {} trend(s), {} anomaly(ies), {} forecast(s), {} recommendation(s)",
                summary.getTotalInsights(), dateRange, trends.size(), anomalies.size(), forecasts.size(), recommendations.size());

        return InsightsData.builder()
                .hasSufficientData(true)
                .revenueTrends(trends)
                .anomalies(anomalies)
                .forecasts(forecasts)
                .recommendations(recommendations)
                .forecast(forecast)
                .summary(summary)
                .generatedAt(generatedAt)
                .build();
    }

    private InsightDataCache newCache(CompanyData companyData, AnalysisDateRange dateRange) {
        Objects.requireNonNull(companyData, "companyData");
        Objects.requireNonNull(dateRange, "dateRange");
        Objects.requireNonNull(companyData.getSales(), "companyData.sales");
        Objects.requireNonNull(companyData.getPurchases(), "companyData.purchases");
        return new InsightDataCache(companyData, dateRange, LocalDate.now(clock));
    }

    /**
     * Runs {@code task} on the insights executor. The task receives a flag that turns true once
     * the returned future is cancelled, and is expected to check it between sub-analyses.
     */
    private <T> CompletableFuture<T> submit(Function<BooleanSupplier, T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                if (future.isDone()) {
                    return;
                }
                try {
                    future.complete(task.apply(future::isCancelled));
                } catch (CancellationException e) {
                    future.cancel(false);
                } catch (RuntimeException e) {
                    log.warn("[Insights] async analysis failed: {}", e.getMessage(), e);
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[Insights] executor rejected analysis task: {}", e.getMessage());
            future.completeExceptionally(e);
        }
        return future;
    }

    private static void checkCancelled(BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            throw new CancellationException("Insights analysis was cancelled");
        }
    }
}
