package com.ella.insights.services.insights;

import java.util.List;

import org.springframework.stereotype.Service;

import com.ella.insights.services.insights.providers.RecommendationInsightProvider;

@Service
public class RecommendationService extends ProviderChainAnalyzer<RecommendationInsightProvider> {

    public RecommendationService(List<RecommendationInsightProvider> providers) {
        super(providers);
    }
}
