package com.ella.insights.dto;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Inclusive date range under analysis.
 */
public record AnalysisDateRange(LocalDate startDate, LocalDate endDate) {

    public AnalysisDateRange {
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException(
                    "startDate " + startDate + " must not be after endDate " + endDate);
        }
    }

    public static AnalysisDateRange of(LocalDate startDate, LocalDate endDate) {
        return new AnalysisDateRange(startDate, endDate);
    }

    public long dayCount() {
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    /**
     * Range of the same length ending the day before this one starts.
     */
    public AnalysisDateRange previousPeriod() {
        long days = dayCount();
        return new AnalysisDateRange(startDate.minusDays(days), startDate.minusDays(1));
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(startDate) && !date.isAfter(endDate);
    }
}
