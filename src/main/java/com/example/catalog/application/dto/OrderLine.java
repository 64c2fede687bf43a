package com.example.catalog.application.dto;

/**
 * Product and quantity pair as submitted by a caller, either as an order line
 * or as a return request. Values are validated by the service.
 */
public record OrderLine(
        long productId,
        long quantity
) {
}
