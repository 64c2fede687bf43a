package com.example.catalog.domain.exception;

/**
 * Exception thrown when a request carries invalid or missing values.
 */
public class InvalidInputException extends DomainException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }
}
