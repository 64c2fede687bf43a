package com.example.catalog.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Request DTO for replacing a product's details. The SKU is optional and
 * kept unchanged when omitted.
 */
public record UpdateProductRequest(
        @NotBlank(message = "Name is required")
        String name,

        String sku,

        @NotNull(message = "Price is required")
        @PositiveOrZero(message = "Price cannot be negative")
        BigDecimal price,

        @PositiveOrZero(message = "Stock cannot be negative")
        long stock
) {}
