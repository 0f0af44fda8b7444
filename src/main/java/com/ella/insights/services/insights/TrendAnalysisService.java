package com.ella.insights.services.insights;

import java.util.List;

import org.springframework.stereotype.Service;

import com.ella.insights.services.insights.providers.TrendInsightProvider;

/**
 * Trend insights comparing the range with the period just before it.
 */
@Service
public class TrendAnalysisService extends ProviderChainAnalyzer<TrendInsightProvider> {

    public TrendAnalysisService(List<TrendInsightProvider> providers) {
        super(providers);
    }
}
