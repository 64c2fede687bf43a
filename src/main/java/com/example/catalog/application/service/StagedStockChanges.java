package com.example.catalog.application.service;

import com.example.catalog.application.port.out.ProductStore;
import com.example.catalog.application.port.out.Transaction;
import com.example.catalog.domain.exception.InsufficientStockException;
import com.example.catalog.domain.exception.InvalidInputException;
import com.example.catalog.domain.model.Product;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pending stock writes of one unit of work.
 *
 * <p>Reservations and restorations are applied to staged copies and read
 * back from them, so several changes to the same product accumulate. Nothing
 * reaches the store until {@link #commit()}.
 */
final class StagedStockChanges {

    private final ProductStore productStore;
    private final Transaction tx;
    private final Map<Long, Product> staged = new LinkedHashMap<>();
    private boolean committed;

    StagedStockChanges(ProductStore productStore, Transaction tx) {
        this.productStore = productStore;
        this.tx = tx;
    }

    /**
     * Returns the product as it will look after commit.
     *
     * @throws com.example.catalog.domain.exception.EntityNotFoundException if the product does not exist
     */
    Product current(long productId) {
        Product pending = staged.get(productId);
        return pending != null ? pending : productStore.getById(tx, productId);
    }

    /**
     * Stages a stock decrement.
     *
     * @throws InsufficientStockException if the staged stock is lower than the quantity
     */
    void reserve(long productId, long quantity) {
        Product product = current(productId);
        if (product.getStock() < quantity) {
            throw new InsufficientStockException(productId, quantity, product.getStock());
        }
        staged.put(productId, product.withStock(product.getStock() - quantity));
    }

    /**
     * Stages a stock increment.
     *
     * @throws InvalidInputException if the restored stock would overflow
     */
    void restore(long productId, long quantity) {
        Product product = current(productId);
        long restored;
        try {
            restored = Math.addExact(product.getStock(), quantity);
        } catch (ArithmeticException e) {
            throw new InvalidInputException(String.format(
                    "Cannot restore %d units of product %d, stock %d is at its limit",
                    quantity, productId, product.getStock()));
        }
        staged.put(productId, product.withStock(restored));
    }

    int size() {
        return staged.size();
    }

    /**
     * Writes every staged product. Must run inside the same unit of work that
     * staged the changes, after all checks have passed.
     *
     * @return the written products in staging order
     */
    List<Product> commit() {
        if (committed) {
            throw new IllegalStateException("Stock changes already committed");
        }
        committed = true;
        List<Product> written = new ArrayList<>(staged.size());
        for (Product product : staged.values()) {
            written.add(productStore.update(tx, product));
        }
        return written;
    }
}
