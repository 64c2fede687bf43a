package com.example.catalog.domain.exception;

/**
 * Exception thrown when there is insufficient stock for a product.
 */
public class InsufficientStockException extends DomainException {

    private final long productId;
    private final long requestedQuantity;
    private final long availableQuantity;

    public InsufficientStockException(long productId, long requestedQuantity, long availableQuantity) {
        super(ErrorCode.NOT_ENOUGH_STOCK,
                String.format("Insufficient stock for product %d: requested %d, available %d",
                        productId, requestedQuantity, availableQuantity));
        this.productId = productId;
        this.requestedQuantity = requestedQuantity;
        this.availableQuantity = availableQuantity;
    }

    public long getProductId() {
        return productId;
    }

    public long getRequestedQuantity() {
        return requestedQuantity;
    }

    public long getAvailableQuantity() {
        return availableQuantity;
    }
}
