package com.example.catalog.application.port.in;

import com.example.catalog.application.dto.CreateProductCommand;
import com.example.catalog.application.dto.UpdateProductCommand;
import com.example.catalog.application.port.out.ProductFilter;
import com.example.catalog.domain.model.Product;

import java.util.List;

/**
 * Inbound port for product catalog maintenance.
 */
public interface ProductCatalogUseCase {

    Product createProduct(CreateProductCommand command);

    Product getProduct(long productId);

    Product updateProduct(UpdateProductCommand command);

    void deleteProduct(long productId);

    List<Product> listProducts(ProductFilter filter);
}
