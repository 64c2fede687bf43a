package com.example.catalog.domain.exception;

/**
 * Exception thrown when a product or order identifier does not exist.
 */
public class EntityNotFoundException extends DomainException {

    private final String entityType;
    private final long entityId;

    public EntityNotFoundException(String entityType, long entityId) {
        super(ErrorCode.NOT_FOUND, String.format("%s not found: %d", entityType, entityId));
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public static EntityNotFoundException product(long productId) {
        return new EntityNotFoundException("Product", productId);
    }

    public static EntityNotFoundException order(long orderId) {
        return new EntityNotFoundException("Order", orderId);
    }

    public String getEntityType() {
        return entityType;
    }

    public long getEntityId() {
        return entityId;
    }
}
