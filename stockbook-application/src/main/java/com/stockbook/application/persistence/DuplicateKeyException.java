package com.stockbook.application.persistence;

/** A unique constraint rejected the write (e.g. a second stock with the same symbol). */
public class DuplicateKeyException extends PersistenceException {

    public DuplicateKeyException(String message) {
        super(message);
    }

    public DuplicateKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
