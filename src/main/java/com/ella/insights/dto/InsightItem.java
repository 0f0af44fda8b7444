package com.ella.insights.dto;

import java.math.BigDecimal;

import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class InsightItem {
    @NonNull
    String title;
    @NonNull
    String description;
    /** Suggested action; {@code null} when the insight is informational only. */
    String recommendation;
    @NonNull
    InsightSeverity severity;
    @NonNull
    InsightCategory category;
    BigDecimal metricValue;
    BigDecimal percentageChange;
}
