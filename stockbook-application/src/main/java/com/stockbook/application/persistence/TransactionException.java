package com.stockbook.application.persistence;

/** Commit or rollback could not be completed, or the transaction could not be committed. */
public class TransactionException extends PersistenceException {

    public TransactionException(String message) {
        super(message);
    }

    public TransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
