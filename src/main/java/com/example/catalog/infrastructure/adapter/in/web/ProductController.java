package com.example.catalog.infrastructure.adapter.in.web;

import com.example.catalog.application.port.in.ProductCatalogUseCase;
import com.example.catalog.application.port.out.ProductFilter;
import com.example.catalog.infrastructure.adapter.in.web.dto.CreateProductRequest;
import com.example.catalog.infrastructure.adapter.in.web.dto.ProductResponse;
import com.example.catalog.infrastructure.adapter.in.web.dto.UpdateProductRequest;
import com.example.catalog.infrastructure.adapter.in.web.mapper.ProductWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.util.List;

/**
 * REST controller for the product catalog.
 */
@RestController
@RequestMapping("/api/v1/products")
@Tag(name = "Products", description = "Product catalog API")
public class ProductController {

    private final ProductCatalogUseCase productCatalogUseCase;
    private final ProductWebMapper mapper;

    public ProductController(ProductCatalogUseCase productCatalogUseCase, ProductWebMapper mapper) {
        this.productCatalogUseCase = productCatalogUseCase;
        this.mapper = mapper;
    }

    @Operation(summary = "Create product")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Product created"),
            @ApiResponse(responseCode = "400", description = "Invalid request")
    })
    @PostMapping
    public Mono<ResponseEntity<ProductResponse>> createProduct(@Valid @RequestBody CreateProductRequest request) {
        return Mono.fromCallable(() -> productCatalogUseCase.createProduct(mapper.toCommand(request)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(product -> ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(product)));
    }

    @Operation(summary = "Get product")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Product found"),
            @ApiResponse(responseCode = "404", description = "Product not found")
    })
    @GetMapping("/{id}")
    public Mono<ResponseEntity<ProductResponse>> getProduct(
            @Parameter(description = "Product ID", required = true)
            @PathVariable long id) {
        return Mono.fromCallable(() -> productCatalogUseCase.getProduct(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(product -> ResponseEntity.ok(mapper.toResponse(product)));
    }

    @Operation(summary = "Update product", description = "Replaces name, price and stock; the SKU is kept when omitted")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Product updated"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "404", description = "Product not found")
    })
    @PutMapping("/{id}")
    public Mono<ResponseEntity<ProductResponse>> updateProduct(
            @Parameter(description = "Product ID", required = true)
            @PathVariable long id,
            @Valid @RequestBody UpdateProductRequest request) {
        return Mono.fromCallable(() -> productCatalogUseCase.updateProduct(mapper.toCommand(id, request)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(product -> ResponseEntity.ok(mapper.toResponse(product)));
    }

    @Operation(summary = "Delete product")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Product deleted"),
            @ApiResponse(responseCode = "404", description = "Product not found")
    })
    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteProduct(
            @Parameter(description = "Product ID", required = true)
            @PathVariable long id) {
        return Mono.fromCallable(() -> {
                    productCatalogUseCase.deleteProduct(id);
                    return ResponseEntity.noContent().<Void>build();
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "List products", description = "Filters by case-insensitive name substring and inclusive price bounds")
    @GetMapping
    public Mono<ResponseEntity<List<ProductResponse>>> listProducts(
            @Parameter(description = "Name contains")
            @RequestParam(name = "q", required = false) String nameContains,
            @Parameter(description = "Minimum price, inclusive")
            @RequestParam(name = "min_price", required = false) BigDecimal minPrice,
            @Parameter(description = "Maximum price, inclusive")
            @RequestParam(name = "max_price", required = false) BigDecimal maxPrice) {
        ProductFilter filter = new ProductFilter(nameContains, minPrice, maxPrice);
        return Mono.fromCallable(() -> productCatalogUseCase.listProducts(filter))
                .subscribeOn(Schedulers.boundedElastic())
                .map(products -> ResponseEntity.ok(products.stream().map(mapper::toResponse).toList()));
    }
}
