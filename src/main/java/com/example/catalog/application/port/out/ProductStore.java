package com.example.catalog.application.port.out;

import com.example.catalog.domain.exception.EntityNotFoundException;
import com.example.catalog.domain.model.Product;

import java.util.List;
import java.util.Optional;

/**
 * Outbound port for product storage.
 *
 * <p>Every operation comes in two forms. The form without a
 * {@link Transaction} takes the store lock itself: shared for reads,
 * exclusive for writes. The form with a transaction is used inside a unit of
 * work and does not lock again.
 */
public interface ProductStore {

    /**
     * Stores a new product under a freshly assigned identifier.
     *
     * @return the stored copy carrying its identifier
     */
    Product create(Product product);

    Product create(Transaction tx, Product product);

    Optional<Product> findById(long id);

    Optional<Product> findById(Transaction tx, long id);

    /**
     * @throws EntityNotFoundException if the product does not exist
     */
    default Product getById(long id) {
        return findById(id).orElseThrow(() -> EntityNotFoundException.product(id));
    }

    /**
     * @throws EntityNotFoundException if the product does not exist
     */
    default Product getById(Transaction tx, long id) {
        return findById(tx, id).orElseThrow(() -> EntityNotFoundException.product(id));
    }

    /**
     * Replaces the stored product with the same identifier.
     *
     * @throws EntityNotFoundException if the product does not exist
     */
    Product update(Product product);

    Product update(Transaction tx, Product product);

    /**
     * @throws EntityNotFoundException if the product does not exist
     */
    void delete(long id);

    void delete(Transaction tx, long id);

    /**
     * Lists matching products in ascending identifier order.
     */
    List<Product> findAll(ProductFilter filter);

    List<Product> findAll(Transaction tx, ProductFilter filter);

    long count();
}
