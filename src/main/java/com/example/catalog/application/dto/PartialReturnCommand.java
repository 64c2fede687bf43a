package com.example.catalog.application.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Command for returning part of a confirmed order's items to stock.
 */
public record PartialReturnCommand(
        long orderId,
        List<OrderLine> items
) {
    public PartialReturnCommand {
        // null entries are kept for the service to reject
        items = items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
    }
}
