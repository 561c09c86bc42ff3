package com.stockbook.domain;

/**
 * Malformed input detected before any I/O (bad symbol, non-positive price, ...).
 */
public class ValidationException extends DomainException {

    private final String field;

    public ValidationException(String message) {
        this(null, message);
    }

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /** Name of the offending field, or null when the rule spans several fields. */
    public String field() {
        return field;
    }
}
