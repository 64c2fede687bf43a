package com.example.catalog.infrastructure.config;

import com.example.catalog.application.port.out.OrderStore;
import com.example.catalog.application.port.out.ProductStore;
import com.example.catalog.infrastructure.persistence.memory.InMemoryTransactionCoordinator;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Actuator endpoint exposing store sizes and unit-of-work counters.
 * The data is volatile and resets on restart.
 */
@Component
@Endpoint(id = "storestats")
public class StoreStatsEndpoint {

    private final ProductStore productStore;
    private final OrderStore orderStore;
    private final InMemoryTransactionCoordinator transactionCoordinator;

    public StoreStatsEndpoint(
            ProductStore productStore,
            OrderStore orderStore,
            InMemoryTransactionCoordinator transactionCoordinator) {
        this.productStore = productStore;
        this.orderStore = orderStore;
        this.transactionCoordinator = transactionCoordinator;
    }

    @ReadOperation
    public Map<String, Object> storeStats() {
        return Map.of(
                "products", productStore.count(),
                "orders", orderStore.count(),
                "transactionsCommitted", transactionCoordinator.getCommittedCount(),
                "transactionsAborted", transactionCoordinator.getAbortedCount()
        );
    }
}
