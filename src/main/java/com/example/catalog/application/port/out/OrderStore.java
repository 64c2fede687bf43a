package com.example.catalog.application.port.out;

import com.example.catalog.domain.exception.EntityNotFoundException;
import com.example.catalog.domain.model.Order;

import java.util.Optional;

/**
 * Outbound port for order storage. Locking follows {@link ProductStore}.
 */
public interface OrderStore {

    /**
     * Stores a new order under a freshly assigned identifier, keeping the
     * order's creation and update timestamps.
     *
     * @return the stored copy carrying its identifier
     */
    Order create(Order order);

    Order create(Transaction tx, Order order);

    /**
     * Returns a copy of the stored order; changes to the copy are not visible
     * until passed to {@link #update}.
     */
    Optional<Order> findById(long id);

    Optional<Order> findById(Transaction tx, long id);

    /**
     * @throws EntityNotFoundException if the order does not exist
     */
    default Order getById(long id) {
        return findById(id).orElseThrow(() -> EntityNotFoundException.order(id));
    }

    /**
     * @throws EntityNotFoundException if the order does not exist
     */
    default Order getById(Transaction tx, long id) {
        return findById(tx, id).orElseThrow(() -> EntityNotFoundException.order(id));
    }

    /**
     * Replaces the stored order and stamps a fresh update timestamp.
     *
     * @return the stored copy
     * @throws EntityNotFoundException if the order does not exist
     */
    Order update(Order order);

    Order update(Transaction tx, Order order);

    long count();
}
