package com.ella.insights.services.insights.providers;

/**
 * Marker for providers run by the trend analysis.
 */
public interface TrendInsightProvider extends InsightProvider {
}
