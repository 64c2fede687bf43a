package com.example.catalog.infrastructure.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request DTO for placing an order via REST API.
 */
public record CreateOrderRequest(
        @NotBlank(message = "Customer name is required")
        String customerName,

        @NotEmpty(message = "Items cannot be empty")
        @Valid
        List<@NotNull(message = "Item cannot be null") OrderItemRequest> items
) {}
