package com.example.catalog.domain.exception;

import java.util.Objects;

/**
 * Base class for business rule violations reported to callers.
 */
public abstract class DomainException extends RuntimeException {

    private final ErrorCode errorCode;

    protected DomainException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "ErrorCode cannot be null");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
