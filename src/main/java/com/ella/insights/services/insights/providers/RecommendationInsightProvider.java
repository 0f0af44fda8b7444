package com.ella.insights.services.insights.providers;

/**
 * Marker for providers run by the recommendation analysis.
 */
public interface RecommendationInsightProvider extends InsightProvider {
}
