package com.example.catalog.application.port.out;

import com.example.catalog.domain.model.Product;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Criteria for listing products: case-insensitive name substring and
 * optional inclusive price bounds. Null fields do not restrict.
 */
public record ProductFilter(
        String nameContains,
        BigDecimal minPrice,
        BigDecimal maxPrice
) {
    public static ProductFilter all() {
        return new ProductFilter(null, null, null);
    }

    public boolean matches(Product product) {
        if (nameContains != null && !nameContains.isEmpty()
                && !product.getName().toLowerCase(Locale.ROOT).contains(nameContains.toLowerCase(Locale.ROOT))) {
            return false;
        }
        if (minPrice != null && product.getPrice().compareTo(minPrice) < 0) {
            return false;
        }
        return maxPrice == null || product.getPrice().compareTo(maxPrice) <= 0;
    }
}
