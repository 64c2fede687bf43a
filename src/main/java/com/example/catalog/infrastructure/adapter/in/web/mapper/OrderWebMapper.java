package com.example.catalog.infrastructure.adapter.in.web.mapper;

import com.example.catalog.application.dto.CreateOrderCommand;
import com.example.catalog.application.dto.OrderLine;
import com.example.catalog.application.dto.PartialReturnCommand;
import com.example.catalog.domain.model.Order;
import com.example.catalog.infrastructure.adapter.in.web.dto.CreateOrderRequest;
import com.example.catalog.infrastructure.adapter.in.web.dto.OrderItemRequest;
import com.example.catalog.infrastructure.adapter.in.web.dto.OrderResponse;
import com.example.catalog.infrastructure.adapter.in.web.dto.PartialReturnRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper between order web DTOs and application DTOs.
 */
@Component
public class OrderWebMapper {

    public CreateOrderCommand toCommand(CreateOrderRequest request) {
        return new CreateOrderCommand(request.customerName(), toLines(request.items()));
    }

    public PartialReturnCommand toCommand(long orderId, PartialReturnRequest request) {
        return new PartialReturnCommand(orderId, toLines(request.items()));
    }

    public OrderResponse toResponse(Order order) {
        List<OrderResponse.Item> items = order.getItems().stream()
                .map(item -> new OrderResponse.Item(item.getProductId(), item.getQuantity()))
                .toList();

        return new OrderResponse(
                order.getId(),
                order.getCustomerName(),
                items,
                order.getStatus().name(),
                order.getCreatedAt(),
                order.getUpdatedAt());
    }

    private List<OrderLine> toLines(List<OrderItemRequest> items) {
        if (items == null) {
            return List.of();
        }
        return items.stream()
                .map(item -> item == null ? null : new OrderLine(item.productId(), item.quantity()))
                .toList();
    }
}
