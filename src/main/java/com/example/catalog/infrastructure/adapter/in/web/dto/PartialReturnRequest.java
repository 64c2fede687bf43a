package com.example.catalog.infrastructure.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request DTO for returning part of an order.
 */
public record PartialReturnRequest(
        @NotEmpty(message = "Items cannot be empty")
        @Valid
        List<@NotNull(message = "Item cannot be null") OrderItemRequest> items
) {}
