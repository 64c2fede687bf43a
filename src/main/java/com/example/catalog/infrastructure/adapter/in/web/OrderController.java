package com.example.catalog.infrastructure.adapter.in.web;

import com.example.catalog.application.port.in.OrderLifecycleUseCase;
import com.example.catalog.infrastructure.adapter.in.web.dto.CreateOrderRequest;
import com.example.catalog.infrastructure.adapter.in.web.dto.OrderResponse;
import com.example.catalog.infrastructure.adapter.in.web.dto.PartialReturnRequest;
import com.example.catalog.infrastructure.adapter.in.web.mapper.OrderWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * REST controller for order operations.
 * The lifecycle service blocks on the store lock, so calls run on the
 * bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/orders")
@Tag(name = "Orders", description = "Order lifecycle API")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final OrderLifecycleUseCase orderLifecycleUseCase;
    private final OrderWebMapper mapper;

    public OrderController(OrderLifecycleUseCase orderLifecycleUseCase, OrderWebMapper mapper) {
        this.orderLifecycleUseCase = orderLifecycleUseCase;
        this.mapper = mapper;
    }

    @Operation(
            summary = "Place order",
            description = """
                    Reserves stock for every line and stores the order as `CONFIRMED`.
                    Lines may repeat a product; stock is checked against the summed quantity.
                    If any product is missing or short, nothing is reserved.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "201",
                    description = "Order placed",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = OrderResponse.class),
                            examples = @ExampleObject(value = """
                                    {
                                      "id": 1,
                                      "customer_name": "John",
                                      "items": [
                                        {"product_id": 1, "quantity": 3},
                                        {"product_id": 2, "quantity": 2}
                                      ],
                                      "status": "CONFIRMED",
                                      "created_at": "2026-10-19T12:00:00Z",
                                      "updated_at": "2026-10-19T12:00:00Z"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid request or not enough stock",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "error": "NOT_ENOUGH_STOCK",
                                      "message": "Insufficient stock for product 1: requested 2, available 1",
                                      "timestamp": "2026-10-19T12:00:00Z"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(responseCode = "404", description = "Product not found")
    })
    @PostMapping
    public Mono<ResponseEntity<OrderResponse>> createOrder(@Valid @RequestBody CreateOrderRequest request) {
        log.info("Received order request with {} items", request.items().size());

        return Mono.fromCallable(() -> orderLifecycleUseCase.createOrder(mapper.toCommand(request)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(order -> ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(order)));
    }

    @Operation(summary = "Get order", description = "Returns the order with its current items and status")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order found"),
            @ApiResponse(responseCode = "400", description = "Invalid order id"),
            @ApiResponse(responseCode = "404", description = "Order not found")
    })
    @GetMapping("/{id}")
    public Mono<ResponseEntity<OrderResponse>> getOrder(
            @Parameter(description = "Order ID", required = true)
            @PathVariable long id) {
        return Mono.fromCallable(() -> orderLifecycleUseCase.getOrder(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(order -> ResponseEntity.ok(mapper.toResponse(order)));
    }

    @Operation(
            summary = "Cancel order",
            description = "Restores the stock of every line and marks a `CONFIRMED` order as `CANCELLED`"
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order cancelled"),
            @ApiResponse(responseCode = "404", description = "Order or product not found"),
            @ApiResponse(responseCode = "409", description = "Order is not CONFIRMED")
    })
    @PostMapping("/{id}/cancel")
    public Mono<ResponseEntity<OrderResponse>> cancelOrder(
            @Parameter(description = "Order ID", required = true)
            @PathVariable long id) {
        log.info("Received cancel request for order {}", id);

        return Mono.fromCallable(() -> orderLifecycleUseCase.cancelOrder(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(order -> ResponseEntity.ok(mapper.toResponse(order)));
    }

    @Operation(
            summary = "Partially return order",
            description = """
                    Returns the given quantities to stock. When several lines hold the same product
                    the earliest line is reduced first. The order stays `CONFIRMED`, even with no items left.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Items returned"),
            @ApiResponse(responseCode = "400", description = "Invalid request or more returned than held"),
            @ApiResponse(responseCode = "404", description = "Order or product not found"),
            @ApiResponse(responseCode = "409", description = "Order is not CONFIRMED")
    })
    @PostMapping("/{id}/partial-return")
    public Mono<ResponseEntity<OrderResponse>> partialReturn(
            @Parameter(description = "Order ID", required = true)
            @PathVariable long id,
            @Valid @RequestBody PartialReturnRequest request) {
        log.info("Received partial return for order {} with {} items", id, request.items().size());

        return Mono.fromCallable(() -> orderLifecycleUseCase.partialReturn(mapper.toCommand(id, request)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(order -> ResponseEntity.ok(mapper.toResponse(order)));
    }
}
