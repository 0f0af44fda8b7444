package com.ella.insights.entities;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@AllArgsConstructor
@Builder
public class LineItem {

    private String productId;

    private String description;

    @Builder.Default
    private BigDecimal quantity = BigDecimal.ONE;

    @Builder.Default
    private BigDecimal unitPrice = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal discount = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal taxRate = BigDecimal.ZERO;

    /**
     * Quantity times unit price, less discount. Missing values count as zero.
     */
    public BigDecimal getSubtotal() {
        return orZero(quantity).multiply(orZero(unitPrice)).subtract(orZero(discount));
    }

    public BigDecimal getAmount() {
        BigDecimal subtotal = getSubtotal();
        return subtotal.add(subtotal.multiply(orZero(taxRate)));
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
