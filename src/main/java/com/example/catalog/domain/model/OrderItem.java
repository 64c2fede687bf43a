package com.example.catalog.domain.model;

import java.util.Objects;

/**
 * A single line of an order. Several lines of the same order may reference
 * the same product.
 */
public final class OrderItem {

    private final long productId;
    private final long quantity;

    private OrderItem(long productId, long quantity) {
        if (productId <= 0) {
            throw new IllegalArgumentException("ProductId must be positive: " + productId);
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        this.productId = productId;
        this.quantity = quantity;
    }

    /**
     * Creates a new OrderItem.
     *
     * @param productId the referenced product (must be positive)
     * @param quantity  the quantity (must be positive)
     * @return new OrderItem instance
     */
    public static OrderItem of(long productId, long quantity) {
        return new OrderItem(productId, quantity);
    }

    /**
     * Returns a copy of this line with a smaller quantity.
     *
     * @param amount units to remove, strictly less than the current quantity
     * @return new OrderItem for the same product
     */
    public OrderItem reduceBy(long amount) {
        if (amount <= 0 || amount >= quantity) {
            throw new IllegalArgumentException(
                    "Reduction must be between 1 and " + (quantity - 1) + ": " + amount);
        }
        return new OrderItem(productId, quantity - amount);
    }

    public long getProductId() {
        return productId;
    }

    public long getQuantity() {
        return quantity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderItem orderItem = (OrderItem) o;
        return productId == orderItem.productId && quantity == orderItem.quantity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(productId, quantity);
    }

    @Override
    public String toString() {
        return "OrderItem{" +
                "productId=" + productId +
                ", quantity=" + quantity +
                '}';
    }
}
