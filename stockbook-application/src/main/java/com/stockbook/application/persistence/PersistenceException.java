package com.stockbook.application.persistence;

/**
 * Storage failure that is not a domain rule violation. Unchecked, like every SQL failure
 * surfaced by the repositories.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
