package com.ella.insights.enums;

public enum InvoiceStatus {
    DRAFT,
    SENT,
    PARTIAL,
    PAID,
    OVERDUE,
    CANCELLED
}
