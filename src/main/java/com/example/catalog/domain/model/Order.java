package com.example.catalog.domain.model;

import com.example.catalog.domain.exception.InvalidOrderStateException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate Root representing a customer order.
 */
public final class Order {

    /**
     * Identifier of an order that has not been stored yet.
     */
    public static final long UNASSIGNED_ID = 0L;

    private final long id;
    private final String customerName;
    private final List<OrderItem> items;
    private final Instant createdAt;
    private final Instant updatedAt;
    private OrderStatus status;

    private Order(long id, String customerName, List<OrderItem> items, OrderStatus status,
                  Instant createdAt, Instant updatedAt) {
        this.customerName = Objects.requireNonNull(customerName, "CustomerName cannot be null");
        this.items = new ArrayList<>(Objects.requireNonNull(items, "Items cannot be null"));
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.createdAt = Objects.requireNonNull(createdAt, "CreatedAt cannot be null");
        this.updatedAt = Objects.requireNonNull(updatedAt, "UpdatedAt cannot be null");
        if (id < 0) {
            throw new IllegalArgumentException("Id cannot be negative: " + id);
        }
        if (customerName.isBlank()) {
            throw new IllegalArgumentException("CustomerName cannot be blank");
        }
        this.id = id;
    }

    /**
     * Creates a confirmed order whose stock has already been reserved.
     * The item list is kept exactly as given, duplicate products included.
     *
     * @param customerName the ordering customer
     * @param items        the order lines (must not be empty)
     * @param placedAt     creation and last-update timestamp
     * @return new unsaved Order in CONFIRMED status
     */
    public static Order place(String customerName, List<OrderItem> items, Instant placedAt) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Order must have at least one item");
        }
        return new Order(UNASSIGNED_ID, customerName, items, OrderStatus.CONFIRMED, placedAt, placedAt);
    }

    /**
     * Reconstitutes an Order from storage.
     */
    public static Order reconstitute(long id, String customerName, List<OrderItem> items,
                                     OrderStatus status, Instant createdAt, Instant updatedAt) {
        return new Order(id, customerName, items, status, createdAt, updatedAt);
    }

    /**
     * Returns an independent copy; mutating the copy never affects this order.
     */
    public Order copy() {
        return new Order(id, customerName, items, status, createdAt, updatedAt);
    }

    /**
     * Marks the order as cancelled.
     *
     * @throws InvalidOrderStateException if the order is not CONFIRMED
     */
    public void cancel() {
        requireConfirmed("cancel");
        this.status = OrderStatus.CANCELLED;
    }

    /**
     * Replaces the item list after a partial return. The status stays
     * CONFIRMED even when no items remain.
     *
     * @throws InvalidOrderStateException if the order is not CONFIRMED
     */
    public void replaceItems(List<OrderItem> remaining) {
        Objects.requireNonNull(remaining, "Items cannot be null");
        requireConfirmed("return items of");
        this.items.clear();
        this.items.addAll(remaining);
    }

    /**
     * @throws InvalidOrderStateException if the order is not CONFIRMED
     */
    public void requireConfirmed(String action) {
        if (status != OrderStatus.CONFIRMED) {
            throw new InvalidOrderStateException(id, status, action);
        }
    }

    /**
     * Sums the held quantity per product across all lines, keyed in order of
     * first appearance.
     */
    public Map<Long, Long> quantitiesByProduct() {
        Map<Long, Long> totals = new LinkedHashMap<>();
        for (OrderItem item : items) {
            totals.merge(item.getProductId(), item.getQuantity(), Long::sum);
        }
        return totals;
    }

    public long getId() {
        return id;
    }

    public String getCustomerName() {
        return customerName;
    }

    public List<OrderItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public OrderStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Order order = (Order) o;
        return id == order.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + id +
                ", status=" + status +
                ", itemCount=" + items.size() +
                '}';
    }
}
