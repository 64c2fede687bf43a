package com.example.catalog.application.dto;

import java.math.BigDecimal;

/**
 * Command for replacing a product's details. A null or blank SKU keeps the
 * stored one.
 */
public record UpdateProductCommand(
        long productId,
        String name,
        String sku,
        BigDecimal price,
        long stock
) {
}
