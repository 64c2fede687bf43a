package com.example.catalog.application.service;

import com.example.catalog.application.dto.CreateOrderCommand;
import com.example.catalog.application.dto.OrderLine;
import com.example.catalog.application.dto.PartialReturnCommand;
import com.example.catalog.application.port.in.OrderLifecycleUseCase;
import com.example.catalog.application.port.out.OrderStore;
import com.example.catalog.application.port.out.ProductStore;
import com.example.catalog.application.port.out.TransactionCoordinator;
import com.example.catalog.domain.exception.InvalidInputException;
import com.example.catalog.domain.model.Order;
import com.example.catalog.domain.model.OrderItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application service for the order lifecycle: stock reservation on
 * placement, restoration on cancellation and partial return.
 *
 * <p>Every mutating operation runs as one unit of work and stages its stock
 * writes in {@link StagedStockChanges}. Staged writes and the order write are
 * applied only after every check of the operation has passed, so a failing
 * operation leaves both stores untouched.
 */
@Service
public class OrderLifecycleService implements OrderLifecycleUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleService.class);

    private final ProductStore productStore;
    private final OrderStore orderStore;
    private final TransactionCoordinator transactionCoordinator;

    public OrderLifecycleService(
            ProductStore productStore,
            OrderStore orderStore,
            TransactionCoordinator transactionCoordinator) {
        this.productStore = productStore;
        this.orderStore = orderStore;
        this.transactionCoordinator = transactionCoordinator;
    }

    @Override
    public Order createOrder(CreateOrderCommand command) {
        if (command.customerName() == null || command.customerName().isBlank()) {
            throw new InvalidInputException("Customer name is required");
        }
        validateLines(command.items(), "Order");
        List<OrderItem> items = command.items().stream()
                .map(line -> OrderItem.of(line.productId(), line.quantity()))
                .toList();
        Map<Long, Long> demand = totalsByProduct(command.items());

        Order created = transactionCoordinator.runExclusive(tx -> {
            StagedStockChanges changes = new StagedStockChanges(productStore, tx);
            demand.forEach(changes::reserve);
            changes.commit();
            return orderStore.create(tx, Order.place(command.customerName(), items, tx.startedAt()));
        });

        log.info("Order {} placed for '{}' with {} line(s) over {} product(s)",
                created.getId(), created.getCustomerName(), items.size(), demand.size());
        return created;
    }

    @Override
    public Order getOrder(long orderId) {
        requirePositiveId(orderId, "Order");
        return orderStore.getById(orderId);
    }

    @Override
    public Order cancelOrder(long orderId) {
        requirePositiveId(orderId, "Order");

        Order cancelled = transactionCoordinator.runExclusive(tx -> {
            Order order = orderStore.getById(tx, orderId);
            order.cancel();
            StagedStockChanges changes = new StagedStockChanges(productStore, tx);
            for (OrderItem item : order.getItems()) {
                changes.restore(item.getProductId(), item.getQuantity());
            }
            changes.commit();
            return orderStore.update(tx, order);
        });

        log.info("Order {} cancelled, stock restored for {} line(s)", orderId, cancelled.getItems().size());
        return cancelled;
    }

    @Override
    public Order partialReturn(PartialReturnCommand command) {
        requirePositiveId(command.orderId(), "Order");
        validateLines(command.items(), "Return");
        Map<Long, Long> requested = totalsByProduct(command.items());

        Order updated = transactionCoordinator.runExclusive(tx -> {
            Order order = orderStore.getById(tx, command.orderId());
            order.requireConfirmed("return items of");

            Map<Long, Long> held = order.quantitiesByProduct();
            requested.forEach((productId, quantity) -> {
                long heldQuantity = held.getOrDefault(productId, 0L);
                if (quantity > heldQuantity) {
                    throw new InvalidInputException(String.format(
                            "Cannot return %d of product %d, order %d holds %d",
                            quantity, productId, order.getId(), heldQuantity));
                }
            });

            int linesBefore = order.getItems().size();
            StagedStockChanges changes = new StagedStockChanges(productStore, tx);
            List<OrderItem> remaining = reconcileReturn(order.getItems(), requested, changes);
            order.replaceItems(remaining);
            log.debug("Order {} return staged: {} product(s) restocked, {} of {} line(s) remain",
                    order.getId(), changes.size(), remaining.size(), linesBefore);
            changes.commit();
            return orderStore.update(tx, order);
        });

        log.info("Order {} partially returned: {}", command.orderId(), requested);
        return updated;
    }

    /**
     * Walks the order lines first to last and consumes the requested return
     * quantity of each product greedily. A line smaller than what is still
     * owed for its product is dropped and the remainder carries over to the
     * next line of that product.
     */
    private List<OrderItem> reconcileReturn(List<OrderItem> items, Map<Long, Long> totalReturns,
                                            StagedStockChanges changes) {
        List<OrderItem> remaining = new ArrayList<>(items.size());
        Map<Long, Long> consumed = new HashMap<>();

        for (OrderItem item : items) {
            long productId = item.getProductId();
            long totalReturn = totalReturns.getOrDefault(productId, 0L);
            long alreadyConsumed = consumed.getOrDefault(productId, 0L);

            if (alreadyConsumed >= totalReturn) {
                remaining.add(item);
                continue;
            }

            long need = totalReturn - alreadyConsumed;
            long available = item.getQuantity();
            if (need < available) {
                remaining.add(item.reduceBy(need));
                consumed.merge(productId, need, Long::sum);
                changes.restore(productId, need);
            } else {
                // whole line returned; any shortfall moves on to the next line
                consumed.merge(productId, available, Long::sum);
                changes.restore(productId, available);
            }
        }
        return remaining;
    }

    private static void validateLines(List<OrderLine> lines, String kind) {
        if (lines.isEmpty()) {
            throw new InvalidInputException(kind + " must have at least one item");
        }
        for (OrderLine line : lines) {
            if (line == null) {
                throw new InvalidInputException(kind + " item cannot be null");
            }
            if (line.productId() <= 0) {
                throw new InvalidInputException("Product id must be positive: " + line.productId());
            }
            if (line.quantity() <= 0) {
                throw new InvalidInputException("Quantity must be positive: " + line.quantity());
            }
        }
    }

    private static Map<Long, Long> totalsByProduct(List<OrderLine> lines) {
        Map<Long, Long> totals = new LinkedHashMap<>();
        try {
            for (OrderLine line : lines) {
                totals.merge(line.productId(), line.quantity(), Math::addExact);
            }
        } catch (ArithmeticException e) {
            throw new InvalidInputException("Total quantity per product is too large");
        }
        return totals;
    }

    private static void requirePositiveId(long id, String kind) {
        if (id <= 0) {
            throw new InvalidInputException(kind + " id must be positive: " + id);
        }
    }
}
