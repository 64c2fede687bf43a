package com.example.catalog.application.port.in;

import com.example.catalog.application.dto.CreateOrderCommand;
import com.example.catalog.application.dto.PartialReturnCommand;
import com.example.catalog.domain.model.Order;

/**
 * Inbound port for placing, inspecting, cancelling and partially returning
 * orders. Failures are reported as
 * {@link com.example.catalog.domain.exception.DomainException} subclasses.
 */
public interface OrderLifecycleUseCase {

    /**
     * Reserves stock for every line and stores a CONFIRMED order. Either all
     * stock is reserved and the order stored, or nothing changes.
     *
     * @param command customer name and order lines; lines may repeat a product
     * @return the stored order with its assigned identifier
     */
    Order createOrder(CreateOrderCommand command);

    /**
     * @param orderId the order identifier (must be positive)
     * @return the stored order
     */
    Order getOrder(long orderId);

    /**
     * Restores the stock of every line and marks the order CANCELLED.
     *
     * @param orderId the order identifier (must be positive)
     * @return the updated order
     */
    Order cancelOrder(long orderId);

    /**
     * Returns part of a CONFIRMED order's quantities to stock, consuming
     * lines of the same product from first to last.
     *
     * @param command order identifier and the quantities to return
     * @return the updated order, still CONFIRMED
     */
    Order partialReturn(PartialReturnCommand command);
}
