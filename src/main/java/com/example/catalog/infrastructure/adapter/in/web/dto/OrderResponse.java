package com.example.catalog.infrastructure.adapter.in.web.dto;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for an order.
 */
public record OrderResponse(
        long id,
        String customerName,
        List<Item> items,
        String status,
        Instant createdAt,
        Instant updatedAt
) {
    public record Item(
            long productId,
            long quantity
    ) {}
}
