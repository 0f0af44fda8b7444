package com.ella.insights.services.insights.providers;

import java.util.List;

import com.ella.insights.dto.InsightItem;
import com.ella.insights.services.insights.InsightDataCache;

public interface InsightProvider {
    List<InsightItem> generate(InsightDataCache cache);
}
