package com.ella.insights.enums;

public enum InsightCategory {
    REVENUE_TREND("Revenue Trend", "#22C55E"),
    EXPENSE_TREND("Expense Trend", "#F59E0B"),
    ANOMALY("Anomaly", "#EF4444"),
    FORECAST("Forecast", "#8B5CF6"),
    INVENTORY("Inventory", "#F59E0B"),
    PRODUCT("Product", "#3B82F6"),
    CUSTOMER("Customer", "#8B5CF6"),
    PAYMENT("Payment", "#F59E0B"),
    RECOMMENDATION("Recommendation", "#22C55E");

    private final String displayName;
    private final String color;

    InsightCategory(String displayName, String color) {
        this.displayName = displayName;
        this.color = color;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getColor() {
        return color;
    }
}
