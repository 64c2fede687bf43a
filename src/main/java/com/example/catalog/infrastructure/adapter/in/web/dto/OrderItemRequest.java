package com.example.catalog.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.Positive;

/**
 * Product and quantity pair used by order placement and partial returns.
 */
public record OrderItemRequest(
        @Positive(message = "Product id must be positive")
        long productId,

        @Positive(message = "Quantity must be positive")
        long quantity
) {}
