package com.example.catalog.application.dto;

import java.math.BigDecimal;

/**
 * Command for adding a product to the catalog.
 */
public record CreateProductCommand(
        String name,
        String sku,
        BigDecimal price,
        long stock
) {
}
