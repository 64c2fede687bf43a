package com.example.catalog.infrastructure.persistence.memory;

import com.example.catalog.application.port.out.ProductFilter;
import com.example.catalog.application.port.out.ProductStore;
import com.example.catalog.application.port.out.Transaction;
import com.example.catalog.domain.exception.EntityNotFoundException;
import com.example.catalog.domain.model.Product;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Volatile product storage. Products are immutable, so stored instances are
 * handed out directly.
 */
@Repository
public class InMemoryProductStore implements ProductStore {

    private final InMemoryStoreLock storeLock;
    // guarded by storeLock; insertion order is id order
    private final Map<Long, Product> products = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryProductStore(InMemoryStoreLock storeLock) {
        this.storeLock = storeLock;
    }

    @Override
    public Product create(Product product) {
        return doCreate(null, product);
    }

    @Override
    public Product create(Transaction tx, Product product) {
        return doCreate(Objects.requireNonNull(tx, "Transaction cannot be null"), product);
    }

    @Override
    public Optional<Product> findById(long id) {
        return doFindById(null, id);
    }

    @Override
    public Optional<Product> findById(Transaction tx, long id) {
        return doFindById(Objects.requireNonNull(tx, "Transaction cannot be null"), id);
    }

    @Override
    public Product update(Product product) {
        return doUpdate(null, product);
    }

    @Override
    public Product update(Transaction tx, Product product) {
        return doUpdate(Objects.requireNonNull(tx, "Transaction cannot be null"), product);
    }

    @Override
    public void delete(long id) {
        doDelete(null, id);
    }

    @Override
    public void delete(Transaction tx, long id) {
        doDelete(Objects.requireNonNull(tx, "Transaction cannot be null"), id);
    }

    @Override
    public List<Product> findAll(ProductFilter filter) {
        return doFindAll(null, filter);
    }

    @Override
    public List<Product> findAll(Transaction tx, ProductFilter filter) {
        return doFindAll(Objects.requireNonNull(tx, "Transaction cannot be null"), filter);
    }

    @Override
    public long count() {
        return storeLock.read(null, () -> (long) products.size());
    }

    private Product doCreate(Transaction tx, Product product) {
        Objects.requireNonNull(product, "Product cannot be null");
        return storeLock.write(tx, () -> {
            Product stored = product.withId(sequence.incrementAndGet());
            products.put(stored.getId(), stored);
            return stored;
        });
    }

    private Optional<Product> doFindById(Transaction tx, long id) {
        return storeLock.read(tx, () -> Optional.ofNullable(products.get(id)));
    }

    private Product doUpdate(Transaction tx, Product product) {
        Objects.requireNonNull(product, "Product cannot be null");
        return storeLock.write(tx, () -> {
            if (!products.containsKey(product.getId())) {
                throw EntityNotFoundException.product(product.getId());
            }
            products.put(product.getId(), product);
            return product;
        });
    }

    private void doDelete(Transaction tx, long id) {
        storeLock.write(tx, () -> {
            if (products.remove(id) == null) {
                throw EntityNotFoundException.product(id);
            }
            return null;
        });
    }

    private List<Product> doFindAll(Transaction tx, ProductFilter filter) {
        ProductFilter criteria = filter != null ? filter : ProductFilter.all();
        return storeLock.read(tx, () -> products.values().stream()
                .filter(criteria::matches)
                .toList());
    }
}
