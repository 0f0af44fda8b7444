package com.ella.insights.entities;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@AllArgsConstructor
@Builder
public class InventoryItem {

    private String id;

    private String productId;

    private String locationId;

    private int inStock;

    private int reserved;

    private int reorderPoint;

    public int getAvailable() {
        return inStock - reserved;
    }
}
