package com.ella.insights.dto;

public record RecentAccuracy(double revenueAccuracy, double expenseAccuracy) {

    public double average() {
        return (revenueAccuracy + expenseAccuracy) / 2;
    }
}
