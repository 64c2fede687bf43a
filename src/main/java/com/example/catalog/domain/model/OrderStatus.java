package com.example.catalog.domain.model;

/**
 * Enum representing the possible states of an Order.
 */
public enum OrderStatus {

    /**
     * Reserved for flows that create an order before stock is reserved.
     * Orders placed through the lifecycle service never use it.
     */
    PENDING,

    /**
     * Stock has been reserved; items may be returned or the order cancelled.
     */
    CONFIRMED,

    /**
     * Order has been cancelled and its stock restored. Terminal.
     */
    CANCELLED
}
