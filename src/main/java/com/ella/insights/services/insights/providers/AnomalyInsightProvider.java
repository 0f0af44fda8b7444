package com.ella.insights.services.insights.providers;

/**
 * Marker for providers run by the anomaly analysis.
 */
public interface AnomalyInsightProvider extends InsightProvider {
}
