package com.ella.insights.entities;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@AllArgsConstructor
@Builder
public class ReturnItem {

    private String productId;

    @Builder.Default
    private BigDecimal quantity = BigDecimal.ONE;

    private String reason;
}
