package com.example.catalog.infrastructure.adapter.in.web.mapper;

import com.example.catalog.application.dto.CreateProductCommand;
import com.example.catalog.application.dto.UpdateProductCommand;
import com.example.catalog.domain.model.Product;
import com.example.catalog.infrastructure.adapter.in.web.dto.CreateProductRequest;
import com.example.catalog.infrastructure.adapter.in.web.dto.ProductResponse;
import com.example.catalog.infrastructure.adapter.in.web.dto.UpdateProductRequest;
import org.springframework.stereotype.Component;

/**
 * Mapper between product web DTOs and application DTOs.
 */
@Component
public class ProductWebMapper {

    public CreateProductCommand toCommand(CreateProductRequest request) {
        return new CreateProductCommand(request.name(), request.sku(), request.price(), request.stock());
    }

    public UpdateProductCommand toCommand(long productId, UpdateProductRequest request) {
        return new UpdateProductCommand(productId, request.name(), request.sku(), request.price(), request.stock());
    }

    public ProductResponse toResponse(Product product) {
        return new ProductResponse(
                product.getId(),
                product.getName(),
                product.getSku(),
                product.getPrice(),
                product.getStock());
    }
}
