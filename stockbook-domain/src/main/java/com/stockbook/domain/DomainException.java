package com.stockbook.domain;

/**
 * Base type for rule violations raised by the domain model.
 * Unchecked: callers decide where to translate it into a user-facing error.
 */
public class DomainException extends RuntimeException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
