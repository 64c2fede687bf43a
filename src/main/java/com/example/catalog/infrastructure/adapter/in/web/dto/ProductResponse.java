package com.example.catalog.infrastructure.adapter.in.web.dto;

import java.math.BigDecimal;

/**
 * Response DTO for a catalog product.
 */
public record ProductResponse(
        long id,
        String name,
        String sku,
        BigDecimal price,
        long stock
) {}
