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
public class SaleReturn {

    private String id;

    private String originalTransactionId;

    private String customerId;

    private LocalDate returnDate;

    @Builder.Default
    private List<ReturnItem> items = List.of();

    @Builder.Default
    private BigDecimal refundAmount = BigDecimal.ZERO;
}
