package com.example.catalog.infrastructure.persistence.memory;

import com.example.catalog.application.port.out.OrderStore;
import com.example.catalog.application.port.out.Transaction;
import com.example.catalog.domain.exception.EntityNotFoundException;
import com.example.catalog.domain.model.Order;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Volatile order storage. Orders are mutable aggregates, so the store keeps
 * private copies and hands out copies.
 */
@Repository
public class InMemoryOrderStore implements OrderStore {

    private final InMemoryStoreLock storeLock;
    private final Clock clock;
    // guarded by storeLock
    private final Map<Long, Order> orders = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryOrderStore(InMemoryStoreLock storeLock, Clock clock) {
        this.storeLock = storeLock;
        this.clock = clock;
    }

    @Override
    public Order create(Order order) {
        return doCreate(null, order);
    }

    @Override
    public Order create(Transaction tx, Order order) {
        return doCreate(Objects.requireNonNull(tx, "Transaction cannot be null"), order);
    }

    @Override
    public Optional<Order> findById(long id) {
        return doFindById(null, id);
    }

    @Override
    public Optional<Order> findById(Transaction tx, long id) {
        return doFindById(Objects.requireNonNull(tx, "Transaction cannot be null"), id);
    }

    @Override
    public Order update(Order order) {
        return doUpdate(null, order);
    }

    @Override
    public Order update(Transaction tx, Order order) {
        return doUpdate(Objects.requireNonNull(tx, "Transaction cannot be null"), order);
    }

    @Override
    public long count() {
        return storeLock.read(null, () -> (long) orders.size());
    }

    private Order doCreate(Transaction tx, Order order) {
        Objects.requireNonNull(order, "Order cannot be null");
        return storeLock.write(tx, () -> {
            Order stored = Order.reconstitute(
                    sequence.incrementAndGet(),
                    order.getCustomerName(),
                    order.getItems(),
                    order.getStatus(),
                    order.getCreatedAt(),
                    order.getUpdatedAt());
            orders.put(stored.getId(), stored);
            return stored.copy();
        });
    }

    private Optional<Order> doFindById(Transaction tx, long id) {
        return storeLock.read(tx, () -> Optional.ofNullable(orders.get(id)).map(Order::copy));
    }

    private Order doUpdate(Transaction tx, Order order) {
        Objects.requireNonNull(order, "Order cannot be null");
        return storeLock.write(tx, () -> {
            if (!orders.containsKey(order.getId())) {
                throw EntityNotFoundException.order(order.getId());
            }
            Order stored = Order.reconstitute(
                    order.getId(),
                    order.getCustomerName(),
                    order.getItems(),
                    order.getStatus(),
                    order.getCreatedAt(),
                    clock.instant());
            orders.put(stored.getId(), stored);
            return stored.copy();
        });
    }
}
