package com.example.catalog.application.service;

import com.example.catalog.application.dto.CreateProductCommand;
import com.example.catalog.application.dto.UpdateProductCommand;
import com.example.catalog.application.port.in.ProductCatalogUseCase;
import com.example.catalog.application.port.out.ProductFilter;
import com.example.catalog.application.port.out.ProductStore;
import com.example.catalog.application.port.out.TransactionCoordinator;
import com.example.catalog.domain.exception.InvalidInputException;
import com.example.catalog.domain.model.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Application service for product catalog maintenance.
 */
@Service
public class ProductCatalogService implements ProductCatalogUseCase {

    private static final Logger log = LoggerFactory.getLogger(ProductCatalogService.class);

    private final ProductStore productStore;
    private final TransactionCoordinator transactionCoordinator;

    public ProductCatalogService(ProductStore productStore, TransactionCoordinator transactionCoordinator) {
        this.productStore = productStore;
        this.transactionCoordinator = transactionCoordinator;
    }

    @Override
    public Product createProduct(CreateProductCommand command) {
        requireText(command.name(), "Name");
        requireText(command.sku(), "SKU");
        validatePriceAndStock(command.price(), command.stock());

        Product created = productStore.create(
                Product.create(command.name(), command.sku(), command.price(), command.stock()));
        log.info("Product {} created: sku={}, stock={}", created.getId(), created.getSku(), created.getStock());
        return created;
    }

    @Override
    public Product getProduct(long productId) {
        requirePositiveId(productId);
        return productStore.getById(productId);
    }

    @Override
    public Product updateProduct(UpdateProductCommand command) {
        requirePositiveId(command.productId());
        requireText(command.name(), "Name");
        validatePriceAndStock(command.price(), command.stock());

        Product updated = transactionCoordinator.runExclusive(tx -> {
            Product existing = productStore.getById(tx, command.productId());
            String sku = command.sku() == null || command.sku().isBlank() ? existing.getSku() : command.sku();
            return productStore.update(tx,
                    existing.withDetails(command.name(), sku, command.price(), command.stock()));
        });
        log.info("Product {} updated: sku={}, stock={}", updated.getId(), updated.getSku(), updated.getStock());
        return updated;
    }

    @Override
    public void deleteProduct(long productId) {
        requirePositiveId(productId);
        productStore.delete(productId);
        log.info("Product {} deleted", productId);
    }

    @Override
    public List<Product> listProducts(ProductFilter filter) {
        List<Product> products = productStore.findAll(filter != null ? filter : ProductFilter.all());
        log.debug("Listed {} product(s) for {}", products.size(), filter);
        return products;
    }

    private static void validatePriceAndStock(BigDecimal price, long stock) {
        if (price == null) {
            throw new InvalidInputException("Price is required");
        }
        if (price.signum() < 0) {
            throw new InvalidInputException("Price cannot be negative: " + price);
        }
        if (stock < 0) {
            throw new InvalidInputException("Stock cannot be negative: " + stock);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(field + " is required");
        }
    }

    private static void requirePositiveId(long id) {
        if (id <= 0) {
            throw new InvalidInputException("Product id must be positive: " + id);
        }
    }
}
