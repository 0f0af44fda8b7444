package com.ella.insights.entities;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.ella.insights.enums.InvoiceStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@AllArgsConstructor
@Builder
public class Invoice {

    private String id;

    private String invoiceNumber;

    private String customerId;

    private LocalDate issueDate;

    private LocalDate dueDate;

    @Builder.Default
    private InvoiceStatus status = InvoiceStatus.SENT;

    @Builder.Default
    private BigDecimal balance = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal effectiveBalanceUsd = BigDecimal.ZERO;

    /**
     * Unpaid, not cancelled and past its due date as of {@code today}.
     */
    public boolean isOverdue(LocalDate today) {
        if (status == InvoiceStatus.PAID || status == InvoiceStatus.CANCELLED) {
            return false;
        }
        return dueDate != null && today.isAfter(dueDate);
    }
}
