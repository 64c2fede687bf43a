package com.example.catalog.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Catalog product with its available stock.
 * Instances are immutable; stock changes produce a new instance.
 */
public final class Product {

    /**
     * Identifier of a product that has not been stored yet.
     */
    public static final long UNASSIGNED_ID = 0L;

    private final long id;
    private final String name;
    private final String sku;
    private final BigDecimal price;
    private final long stock;

    private Product(long id, String name, String sku, BigDecimal price, long stock) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.sku = Objects.requireNonNull(sku, "Sku cannot be null");
        this.price = Objects.requireNonNull(price, "Price cannot be null");
        if (id < 0) {
            throw new IllegalArgumentException("Id cannot be negative: " + id);
        }
        if (price.signum() < 0) {
            throw new IllegalArgumentException("Price cannot be negative: " + price);
        }
        if (stock < 0) {
            throw new IllegalArgumentException("Stock cannot be negative: " + stock);
        }
        this.id = id;
        this.stock = stock;
    }

    /**
     * Creates a product that has not been assigned an identifier yet.
     *
     * @param name  display name
     * @param sku   stock keeping unit
     * @param price unit price, zero or more
     * @param stock available units, zero or more
     * @return new unsaved Product
     */
    public static Product create(String name, String sku, BigDecimal price, long stock) {
        return new Product(UNASSIGNED_ID, name, sku, price, stock);
    }

    /**
     * Reconstitutes a stored product.
     */
    public static Product reconstitute(long id, String name, String sku, BigDecimal price, long stock) {
        return new Product(id, name, sku, price, stock);
    }

    public Product withId(long newId) {
        return new Product(newId, name, sku, price, stock);
    }

    public Product withStock(long newStock) {
        return new Product(id, name, sku, price, newStock);
    }

    public Product withDetails(String newName, String newSku, BigDecimal newPrice, long newStock) {
        return new Product(id, newName, newSku, newPrice, newStock);
    }

    public boolean isAssigned() {
        return id != UNASSIGNED_ID;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getSku() {
        return sku;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public long getStock() {
        return stock;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Product product = (Product) o;
        return id == product.id &&
                stock == product.stock &&
                Objects.equals(name, product.name) &&
                Objects.equals(sku, product.sku) &&
                price.compareTo(product.price) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, sku, price.stripTrailingZeros(), stock);
    }

    @Override
    public String toString() {
        return "Product{" +
                "id=" + id +
                ", sku=" + sku +
                ", price=" + price.toPlainString() +
                ", stock=" + stock +
                '}';
    }
}
