package com.ella.insights.services.insights;

import java.util.ArrayList;
import java.util.List;

import com.ella.insights.dto.InsightItem;
import com.ella.insights.services.insights.providers.InsightProvider;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs an ordered chain of providers over one cache. A provider that throws is logged and
 * skipped so the rest of the chain still contributes.
 */
@Slf4j
public abstract class ProviderChainAnalyzer<P extends InsightProvider> {

    private final List<P> providers;

    protected ProviderChainAnalyzer(List<P> providers) {
        this.providers = providers != null ? List.copyOf(providers) : List.of();
    }

    public List<InsightItem> analyze(InsightDataCache cache) {
        List<InsightItem> out = new ArrayList<>();
        for (P provider : providers) {
            try {
                List<InsightItem> generated = provider.generate(cache);
                if (generated != null) {
                    out.addAll(generated);
                }
            } catch (RuntimeException e) {
                log.warn("[Insights] provider {} failed for range {}: {}",
                        provider.getClass().getSimpleName(), cache.getDateRange(), e.getMessage(), e);
            }
        }
        log.debug("[Insights] {} produced {} insight(s)", getClass().getSimpleName(), out.size());
        return List.copyOf(out);
    }
}
