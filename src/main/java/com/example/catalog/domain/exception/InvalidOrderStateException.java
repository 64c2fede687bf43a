package com.example.catalog.domain.exception;

import com.example.catalog.domain.model.OrderStatus;

/**
 * Exception thrown when an operation is attempted against an order whose
 * status does not permit it, e.g. cancelling an already cancelled order.
 */
public class InvalidOrderStateException extends DomainException {

    private final long orderId;
    private final OrderStatus currentStatus;
    private final String action;

    public InvalidOrderStateException(long orderId, OrderStatus currentStatus, String action) {
        super(ErrorCode.INVALID_STATE,
                String.format("Cannot %s order %d in status %s", action, orderId, currentStatus));
        this.orderId = orderId;
        this.currentStatus = currentStatus;
        this.action = action;
    }

    public long getOrderId() {
        return orderId;
    }

    public OrderStatus getCurrentStatus() {
        return currentStatus;
    }

    public String getAction() {
        return action;
    }
}
