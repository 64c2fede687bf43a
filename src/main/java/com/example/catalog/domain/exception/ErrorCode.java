package com.example.catalog.domain.exception;

/**
 * Error kinds surfaced by the catalog and order operations.
 * The web layer maps each kind to a response status.
 */
public enum ErrorCode {

    /**
     * Malformed or missing fields, non-positive identifiers or quantities,
     * over-return requests.
     */
    INVALID_INPUT,

    /**
     * Referenced product or order does not exist.
     */
    NOT_FOUND,

    /**
     * Requested quantity exceeds the stock available at order creation.
     */
    NOT_ENOUGH_STOCK,

    /**
     * The order's status does not permit the attempted operation.
     */
    INVALID_STATE
}
