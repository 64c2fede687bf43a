package com.example.catalog.application.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Command for placing a new order.
 */
public record CreateOrderCommand(
        String customerName,
        List<OrderLine> items
) {
    public CreateOrderCommand {
        // null entries are kept for the service to reject
        items = items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
    }
}
