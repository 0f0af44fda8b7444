package com.ella.insights.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@AllArgsConstructor
@Builder
public class Sale implements LedgerTransaction {

    private String id;

    private LocalDate date;

    private String customerId;

    @Builder.Default
    private BigDecimal effectiveTotalUsd = BigDecimal.ZERO;

    @Builder.Default
    private List<LineItem> lineItems = List.of();
}
