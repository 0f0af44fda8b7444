package com.ella.insights.services.insights;

import java.util.List;

import org.springframework.stereotype.Service;

import com.ella.insights.services.insights.providers.AnomalyInsightProvider;

@Service
public class AnomalyDetectionService extends ProviderChainAnalyzer<AnomalyInsightProvider> {

    public AnomalyDetectionService(List<AnomalyInsightProvider> providers) {
        super(providers);
    }
}
